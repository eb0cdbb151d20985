package io.vecbench.cli;

import io.vecbench.core.backend.supabase.SupabaseSchema;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "supabase-sql", description = "Print the pgvector setup SQL for every namespace")
public final class SupabaseSqlCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println(SupabaseSchema.fullSql());
        return 0;
    }
}
