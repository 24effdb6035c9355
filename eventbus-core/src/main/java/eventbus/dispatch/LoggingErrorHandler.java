package eventbus.dispatch;

import eventbus.DispatchErrorHandler;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default error handler: logs the failure at {@link Level#SEVERE} with its stack trace.
 */
public final class LoggingErrorHandler implements DispatchErrorHandler {
  private static final Logger DEFAULT_LOGGER = Logger.getLogger(LoggingErrorHandler.class.getName());

  private final Logger logger;

  public LoggingErrorHandler() {
    this(DEFAULT_LOGGER);
  }

  public LoggingErrorHandler(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void onError(String event, Exception error, List<Object> args) {
    logger.log(Level.SEVERE, "An exception was raised while dispatching a '" + event + "' event", error);
  }
}
