package io.xrelay.feed;

import java.util.List;

public record RelaySource(String name, String url, FeedFormat format) {
    public RelaySource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("source name must not be blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("source url must not be blank");
        }
        format = format == null ? FeedFormat.LINES : format;
    }

    public static List<RelaySource> defaults() {
        return List.of(
                new RelaySource("ProxyScrape",
                        "https://api.proxyscrape.com/v2/?request=getproxies&protocol=http&timeout=5000&limit=20",
                        FeedFormat.LINES),
                new RelaySource("GitHub-clarketm",
                        "https://raw.githubusercontent.com/clarketm/proxy-list/master/proxy-list-raw.txt",
                        FeedFormat.LINES),
                new RelaySource("GitHub-ShiftyTR",
                        "https://raw.githubusercontent.com/ShiftyTR/Proxy-List/master/proxy.txt",
                        FeedFormat.LINES),
                new RelaySource("GitHub-fate0",
                        "https://raw.githubusercontent.com/fate0/proxylist/master/proxy.list",
                        FeedFormat.JSON_LINES),
                new RelaySource("FreeProxyList",
                        "https://raw.githubusercontent.com/TheSpeedX/PROXY-List/main/http.txt",
                        FeedFormat.LINES),
                new RelaySource("ProxyListDownload",
                        "https://raw.githubusercontent.com/monosans/proxy-list/main/proxies/http.txt",
                        FeedFormat.LINES)
        );
    }
}
