package io.vecbench.core.pool;

@FunctionalInterface
public interface WorkUnit {
    void run(int index) throws Exception;
}
