package io.vecbench.core.backend.supabase;

import io.vecbench.core.namespace.NamespaceCatalog;

/**
 * pgvector DDL for the benchmark tables: one table per namespace, an HNSW cosine index, and a
 * {@code match_<table>} function returning similarity.
 */
public final class SupabaseSchema {

    private SupabaseSchema() {
    }

    public static String tableName(String namespace) {
        return namespace.replace('-', '_');
    }

    public static String extensionSql() {
        return "-- Enable pgvector extension\nCREATE EXTENSION IF NOT EXISTS vector;";
    }

    public static String namespaceSql(String namespace, int dimensions) {
        String table = tableName(namespace);
        return """
            -- Table and function for %1$s
            CREATE TABLE IF NOT EXISTS %2$s (
              id TEXT PRIMARY KEY,
              title TEXT,
              text TEXT,
              embedding vector(%3$d)
            );

            CREATE INDEX IF NOT EXISTS %2$s_embedding_idx
            ON %2$s USING hnsw (embedding vector_cosine_ops);

            CREATE OR REPLACE FUNCTION match_%2$s(
              query_embedding vector(%3$d),
              match_count int
            )
            RETURNS TABLE (
              id text,
              title text,
              text text,
              similarity float
            )
            LANGUAGE plpgsql AS $$
            BEGIN
              RETURN QUERY
              SELECT
                %2$s.id,
                %2$s.title,
                %2$s.text,
                1 - (%2$s.embedding <=> query_embedding) as similarity
              FROM %2$s
              ORDER BY %2$s.embedding <=> query_embedding
              LIMIT match_count;
            END;
            $$;
            """.formatted(namespace, table, dimensions);
    }

    /**
     * Setup script covering every catalog namespace.
     */
    public static String fullSql() {
        StringBuilder sql = new StringBuilder(extensionSql()).append("\n\n");
        for (String namespace : NamespaceCatalog.all()) {
            sql.append(namespaceSql(namespace, NamespaceCatalog.dimensions(namespace))).append('\n');
        }
        return sql.toString();
    }
}
