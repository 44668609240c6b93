package villagecompute.newsence.api.types;

/**
 * Structured error body: {@code {"success": false, "error": {"code": ..., "message": ...}}}.
 */
public record ApiErrorType(boolean success, ErrorDetail error) {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    public static final String BATCH_TOO_LARGE = "BATCH_TOO_LARGE";

    public static final String UNAUTHORIZED = "UNAUTHORIZED";

    public static final String FORBIDDEN = "FORBIDDEN";

    public static final String RATE_LIMITED = "RATE_LIMITED";

    public static final String NOT_FOUND = "NOT_FOUND";

    public static final String DATASTORE_ERROR = "DATASTORE_ERROR";

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static ApiErrorType of(String code, String message) {
        return new ApiErrorType(false, new ErrorDetail(code, message));
    }

    public record ErrorDetail(String code, String message) {
    }
}
