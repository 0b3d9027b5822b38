package net.stepwise.core.model;

/** 동시에 두 개의 스키마 변경이 걸리면 안 되는 대상 (table, shard, connection). */
public record ResourceKey(String table, String shard, String connection) {
}
