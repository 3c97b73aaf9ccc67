package util;

import java.util.Stack;

/**
 * Console logger. Regions of the analysis can be silenced by pushing
 * <code>false</code> and restored with {@link #pop()}.
 */
public class Logger {
    private static final Stack<Boolean> stack;

    static {
        stack = new Stack<>();
        stack.push(true);
    }

    private static boolean shouldLog() {
        return stack.peek();
    }

    public static void push(boolean b) {
        stack.push(b);
    }

    public static void pop() {
        if (stack.size() == 1) {
            throw new RuntimeException("Unbalanced Logger.pop()");
        }
        stack.pop();
    }

    public static void println(String s) {
        if (shouldLog()) {
            System.err.println(s);
        }
    }
}
