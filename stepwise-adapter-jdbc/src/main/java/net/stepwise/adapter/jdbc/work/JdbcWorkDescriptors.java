package net.stepwise.adapter.jdbc.work;

import com.fasterxml.jackson.databind.JsonNode;
import net.stepwise.core.spi.Sleeper;
import net.stepwise.core.work.MigrationArguments;
import net.stepwise.core.work.WorkDescriptorRegistry;

/** 기본 제공 JDBC 작업들을 레지스트리에 올린다. */
public final class JdbcWorkDescriptors {
    private JdbcWorkDescriptors() {}

    public static WorkDescriptorRegistry registerAll(WorkDescriptorRegistry registry, DataSourceResolver resolver) {
        return registerAll(registry, resolver, Sleeper.SYSTEM);
    }

    public static WorkDescriptorRegistry registerAll(WorkDescriptorRegistry registry, DataSourceResolver resolver, Sleeper sleeper) {
        return registry
                .register(BackfillColumn.NAME, (args, ctx) -> new BackfillColumn(
                        resolver.resolve(ctx.connectionName()),
                        args.getString(0), args.getString(1), args.get(2), options(args, 3), sleeper))
                .register(CopyColumn.NAME, (args, ctx) -> new CopyColumn(
                        resolver.resolve(ctx.connectionName()),
                        args.getString(0), args.getString(1), args.getString(2), options(args, 3), sleeper))
                .register(DeleteOrphanedRecords.NAME, (args, ctx) -> new DeleteOrphanedRecords(
                        resolver.resolve(ctx.connectionName()),
                        args.getString(0), args.getString(1), args.getString(2), options(args, 3), sleeper))
                .register(SchemaStatement.NAME, (args, ctx) -> new SchemaStatement(
                        resolver.resolve(ctx.connectionName()),
                        args.getString(0), args.find(1).map(JsonNode::asLong).orElse(0L)));
    }

    private static RangeOptions options(MigrationArguments args, int index) {
        return RangeOptions.from(args.find(index));
    }
}
