package net.stepwise.core.work;

import net.stepwise.core.model.ExecutionContext;

@FunctionalInterface
public interface WorkDescriptorFactory {
    WorkDescriptor<?> create(MigrationArguments arguments, ExecutionContext ctx) throws Exception;
}
