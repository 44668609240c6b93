package villagecompute.newsence.integration.hackernews;

/**
 * Flattened comment with its markup stripped.
 *
 * @param id
 *            comment id, 0 when unknown
 * @param author
 *            username, may be null
 * @param text
 *            plain text, never blank
 */
public record HnComment(long id, String author, String text) {

    public String attributed() {
        return author == null || author.isBlank() ? text : author + ": " + text;
    }
}
