package com.pineparser;

import com.pineparser.ast.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs recursive work on a thread whose stack is sized for the expected nesting.
 *
 * <p>The grammar, the dump and the unparser all recurse once per nesting level. Shallow
 * work runs on the calling thread; anything deeper runs on a short-lived worker with
 * {@link #STACK_PER_LEVEL} bytes of stack per level, and the caller waits for it.
 * Exceptions and errors thrown by the work reach the caller unchanged.</p>
 */
public final class DeepStack {

    /** Work nested at most this deep runs on the calling thread. */
    public static final int INLINE_LEVELS = 200;

    static final long STACK_PER_LEVEL = 4096L;
    static final long BASE_STACK = 1L << 20;

    private DeepStack() {
        // Utility class
    }

    public static <T> T call(int levels, Supplier<T> task) {
        if (levels <= INLINE_LEVELS) {
            return task.get();
        }

        AtomicReference<T> result = new AtomicReference<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Runnable work = () -> {
            try {
                result.set(task.get());
            } catch (Throwable t) {
                failure.set(t);
            }
        };
        Thread worker = new Thread(null, work, "pinecone-deep-stack", BASE_STACK + levels * STACK_PER_LEVEL);
        worker.setDaemon(true);
        worker.start();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + worker.getName(), e);
        }

        Throwable t = failure.get();
        if (t instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (t instanceof Error error) {
            throw error;
        }
        if (t != null) {
            throw new IllegalStateException(t);
        }
        return result.get();
    }

    /**
     * Nesting depth of an AST value (a node, a list of values or a scalar), counting one level
     * per node and two per list, which is how many recursive steps a walk over
     * {@link Node#fields()} takes. Computed without recursion.
     */
    public static int treeDepth(Object root) {
        if (!(root instanceof Node) && !(root instanceof List<?>)) {
            return 1;
        }
        Deque<Object> values = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        values.push(root);
        depths.push(1);
        int max = 0;
        while (!values.isEmpty()) {
            Object value = values.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            if (value instanceof Node node) {
                for (Node.Field field : node.fields()) {
                    push(values, depths, field.value(), depth);
                }
            } else if (value instanceof List<?> list) {
                for (Object item : list) {
                    push(values, depths, item, depth);
                }
            }
        }
        return max;
    }

    private static void push(Deque<Object> values, Deque<Integer> depths, Object value, int depth) {
        if (value instanceof Node) {
            values.push(value);
            depths.push(depth + 1);
        } else if (value instanceof List<?>) {
            values.push(value);
            depths.push(depth + 2);
        }
    }
}
