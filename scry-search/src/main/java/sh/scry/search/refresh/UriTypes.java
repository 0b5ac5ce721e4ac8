// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Classifies agent URIs.
 */
public final class UriTypes {

    public static final String IPFS = "ipfs";
    public static final String HTTPS = "https";
    public static final String HTTP = "http";
    public static final String UNKNOWN = "unknown";

    private static final List<String> IPFS_GATEWAYS = List.of(
            "ipfs.io", "gateway.pinata.cloud", "cloudflare-ipfs.com", "dweb.link", "ipfs.fleek.co");

    private UriTypes() {
    }

    public static String detect(final @Nullable String uri) {
        if (uri == null) {
            return UNKNOWN;
        }
        if (uri.startsWith("ipfs://")) {
            return IPFS;
        }
        if (uri.startsWith("https://")) {
            return HTTPS;
        }
        if (uri.startsWith("http://")) {
            return HTTP;
        }
        return isBareCid(uri) ? IPFS : UNKNOWN;
    }

    /**
     * CIDv0 ({@code Qm...}, 46 chars) or CIDv1 ({@code baf...}).
     */
    static boolean isBareCid(final String uri) {
        if (uri.startsWith("Qm") && uri.length() == 46) {
            return true;
        }
        return uri.startsWith("baf") && uri.length() >= 8;
    }

    /**
     * @return the content path of an IPFS URI or gateway URL ({@code <cid>[/path]}), or null
     */
    static @Nullable String ipfsPath(final String uri) {
        if (uri.startsWith("ipfs://")) {
            return uri.substring("ipfs://".length());
        }
        if (isBareCid(uri)) {
            return uri;
        }
        final int marker = uri.indexOf("/ipfs/");
        if (marker >= 0 && IPFS_GATEWAYS.stream().anyMatch(uri::contains)) {
            return uri.substring(marker + "/ipfs/".length());
        }
        return null;
    }
}
