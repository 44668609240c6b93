package villagecompute.newsence.processors;

/**
 * A citable source of a structured Hacker News note: the linked article ({@code article}), the thread itself
 * ({@code hn}) or one of the top comments ({@code c1}..{@code c6}).
 */
record HnSource(String id, String label, String url) {
}
