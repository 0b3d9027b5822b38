package net.stepwise.core.work;

import net.stepwise.core.exception.UnknownWorkDescriptorException;
import net.stepwise.core.exception.ValidationException;
import net.stepwise.core.model.ExecutionContext;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이름 -> 팩토리. 기동 시 채우고, 모르는 이름은 명시적으로 실패한다.
 */
public final class WorkDescriptorRegistry {
    private final Map<String, WorkDescriptorFactory> factories = new ConcurrentHashMap<>();

    public WorkDescriptorRegistry register(String name, WorkDescriptorFactory factory) {
        if (name == null || name.isBlank()) throw new ValidationException("work descriptor name is required");
        if (factories.putIfAbsent(name, factory) != null) {
            throw new ValidationException("Work descriptor '" + name + "' is already registered");
        }
        return this;
    }

    public WorkDescriptorRegistry register(WorkDescriptorRegistration registration) {
        return register(registration.name(), registration.factory());
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(factories.keySet());
    }

    public WorkDescriptor<?> create(String name, MigrationArguments arguments, ExecutionContext ctx) throws Exception {
        WorkDescriptorFactory f = name == null ? null : factories.get(name);
        if (f == null) throw new UnknownWorkDescriptorException(name);
        return f.create(arguments, ctx);
    }
}
