package com.marketdw.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * JDBC tracing on the {@code SQL} logger: statement text, elapsed time and affected rows.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch");
    private static final int MAX_SQL_CHARS = 800;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return proxy(Connection.class, (p, method, args) -> {
            Object out = invoke(delegate, method, args);
            String name = method.getName();
            if (out instanceof PreparedStatement && "prepareStatement".equals(name) && args != null && args[0] instanceof String) {
                return proxy(PreparedStatement.class, new Tracer(out, (String) args[0], logger));
            }
            if (out instanceof Statement && "createStatement".equals(name)) {
                return proxy(Statement.class, new Tracer(out, null, logger));
            }
            return out;
        });
    }

    @SuppressWarnings("unchecked")
    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class[]{type}, handler);
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    /**
     * Times execute calls of one statement. {@code preparedSql} is null for plain statements,
     * whose SQL arrives as the first argument of each execute call.
     */
    private static final class Tracer implements InvocationHandler {
        private final Object delegate;
        private final String preparedSql;
        private final Logger logger;
        private int batched;

        private Tracer(Object delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if ("addBatch".equals(name) && (args == null || args.length == 0)) {
                batched++;
            }
            if (!EXECUTE_METHODS.contains(name)) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql != null ? preparedSql
                    : (args != null && args.length > 0 && args[0] instanceof String ? (String) args[0] : "");
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isDebugEnabled()) {
                    logger.debug("SQL ok method={} elapsed_ms={}{} sql={}",
                            name, elapsedMs(started), describe(name, out), normalize(sql));
                }
                return out;
            } catch (Throwable error) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}",
                        name, elapsedMs(started), error.getMessage(), normalize(sql));
                throw error;
            }
        }

        private String describe(String method, Object result) {
            if (method.endsWith("Batch")) {
                int count = batched;
                batched = 0;
                return " batched_statements=" + count;
            }
            if (result instanceof Integer || result instanceof Long) {
                return " rows=" + result;
            }
            return "";
        }
    }

    private static String elapsedMs(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String normalize(String sql) {
        String normalized = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= MAX_SQL_CHARS ? normalized : normalized.substring(0, MAX_SQL_CHARS) + "...";
    }
}
