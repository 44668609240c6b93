package villagecompute.newsence.api.types;

import java.util.List;

public record SubmitResponseType(boolean success, List<SubmitResultType> results) {
}
