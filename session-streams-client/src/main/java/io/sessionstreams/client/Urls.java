package io.sessionstreams.client;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

final class Urls {
    private Urls() {}

    /** Appends query parameters, keeping any the URL already has. */
    static URI withQuery(URI base, Map<String, String> params) {
        if (params.isEmpty()) return base;
        StringBuilder query = new StringBuilder();
        String existing = base.getRawQuery();
        if (existing != null && !existing.isEmpty()) {
            query.append(existing);
        }
        params.forEach((k, v) -> {
            if (query.length() > 0) query.append('&');
            query.append(encode(k)).append('=').append(encode(v));
        });
        String s = base.toString();
        int cut = s.indexOf('?');
        int hash = s.indexOf('#');
        String prefix = cut >= 0 ? s.substring(0, cut) : (hash >= 0 ? s.substring(0, hash) : s);
        String fragment = hash >= 0 ? s.substring(hash) : "";
        return URI.create(prefix + "?" + query + fragment);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
