package FileServer;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Writes one log line per served request, plus request-scoped errors and debug output,
 * in either JSON or plain text.
 */
public class RequestLogger {

    private final Logger logger;
    private final boolean jsonFormat;
    private final String level;

    public RequestLogger(Logger logger, boolean jsonFormat, String level) {
        this.logger = logger;
        this.jsonFormat = jsonFormat;
        this.level = level;
    }

    public RequestLogger(Logger logger, StaticFileConfig config) {
        this(logger, config.isJsonLogging(), config.getLoggingLevel());
    }

    public String generateRequestId() {
        return UUID.randomUUID().toString();
    }

    public void logRequest(String requestId, String method, String path,
                          int statusCode, long durationMs, long bytesSent) {
        if (jsonFormat) {
            String timestamp = ZonedDateTime.now().format(DateTimeFormatter.ISO_INSTANT);

            StringBuilder json = new StringBuilder("{");
            json.append("\"timestamp\":\"").append(timestamp).append("\",");
            json.append("\"level\":\"INFO\",");
            json.append("\"message\":\"static file request\",");
            json.append("\"requestId\":\"").append(requestId).append("\",");
            json.append("\"method\":\"").append(escapeJson(method)).append("\",");
            json.append("\"path\":\"").append(escapeJson(path)).append("\",");
            json.append("\"statusCode\":").append(statusCode).append(",");
            json.append("\"duration\":").append(durationMs).append(",");
            json.append("\"bytesSent\":").append(bytesSent);
            json.append("}");

            logger.info(json.toString());
        } else {
            logger.info(String.format("%s %s - %d - %dms - %d bytes [%s]",
                method, path, statusCode, durationMs, bytesSent, requestId));
        }
    }

    public void logError(String requestId, String message, Throwable throwable) {
        if (jsonFormat) {
            String timestamp = ZonedDateTime.now().format(DateTimeFormatter.ISO_INSTANT);

            StringBuilder json = new StringBuilder("{");
            json.append("\"timestamp\":\"").append(timestamp).append("\",");
            json.append("\"level\":\"ERROR\",");
            json.append("\"message\":\"").append(escapeJson(message)).append("\",");
            json.append("\"requestId\":\"").append(requestId).append("\"");

            if (throwable != null) {
                json.append(",\"exception\":\"").append(escapeJson(throwable.getClass().getName())).append("\"");
                json.append(",\"exceptionMessage\":\"").append(escapeJson(throwable.getMessage())).append("\"");
            }

            json.append("}");

            logger.warning(json.toString());
        } else {
            String logMessage = String.format("[%s] %s", requestId, message);
            if (throwable != null) {
                logMessage += " - " + throwable.getClass().getName() + ": " + throwable.getMessage();
            }
            logger.warning(logMessage);
        }
    }

    public void logDebug(String requestId, String message) {
        if (!shouldLog("DEBUG")) {
            return;
        }

        if (jsonFormat) {
            String timestamp = ZonedDateTime.now().format(DateTimeFormatter.ISO_INSTANT);

            StringBuilder json = new StringBuilder("{");
            json.append("\"timestamp\":\"").append(timestamp).append("\",");
            json.append("\"level\":\"DEBUG\",");
            json.append("\"message\":\"").append(escapeJson(message)).append("\",");
            json.append("\"requestId\":\"").append(requestId).append("\"");
            json.append("}");

            logger.fine(json.toString());
        } else {
            logger.fine(String.format("[%s] %s", requestId, message));
        }
    }

    boolean shouldLog(String logLevel) {
        return getLevelValue(logLevel) >= getLevelValue(this.level);
    }

    private int getLevelValue(String level) {
        switch (level.toUpperCase()) {
            case "DEBUG":
                return 0;
            case "INFO":
                return 1;
            case "WARN":
                return 2;
            case "ERROR":
                return 3;
            default:
                return 1; // Default to INFO
        }
    }

    static String escapeJson(String str) {
        if (str == null) {
            return "";
        }

        return str
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
    }
}
