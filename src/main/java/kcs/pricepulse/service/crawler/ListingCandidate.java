package kcs.pricepulse.service.crawler;

/** One search result on a competing platform. */
public record ListingCandidate(String platform, String name, long price, String url) {
}
