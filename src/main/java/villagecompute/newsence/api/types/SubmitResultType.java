package villagecompute.newsence.api.types;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.newsence.services.SubmissionResult;

/**
 * Per-URL submission result. Absent fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitResultType(@JsonProperty("url") String url,

        @JsonProperty("itemId") UUID itemId,

        @JsonProperty("title") String title,

        @JsonProperty("alreadyExists") Boolean alreadyExists,

        @JsonProperty("error") String error) {

    public static SubmitResultType from(SubmissionResult result) {
        return new SubmitResultType(result.url(), result.itemId(), result.title(),
                result.alreadyExists() ? Boolean.TRUE : null, result.error());
    }
}
