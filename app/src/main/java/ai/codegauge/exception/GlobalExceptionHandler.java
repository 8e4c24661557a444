package ai.codegauge.exception;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.CancellationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class GlobalExceptionHandler implements UncaughtExceptionHandler {
    private static final Logger logger = LogManager.getLogger(GlobalExceptionHandler.class);

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        handle(thread, throwable);
    }

    /**
     * Logs the exception. InterruptedException and CancellationException are expected when a scan is cut short and
     * are only logged at debug.
     */
    public static void handle(Thread thread, Throwable th) {
        if (isCausedBy(th, InterruptedException.class) || isCausedBy(th, CancellationException.class)) {
            logger.debug("Suppressing cancellation/interrupt on thread %s".formatted(thread.getName()), th);
            return;
        }
        logger.error("Uncaught exception on thread %s".formatted(thread.getName()), th);
    }

    static boolean isCausedBy(Throwable th, Class<? extends Throwable> type) {
        for (Throwable t = th; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
