package com.relayauthority.payment;

import com.relayauthority.crypto.NostrIds;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A parsed {@code nostr+walletconnect://<walletPubkey>?relay=<url>&secret=<hex>} URI (NIP-47).
 */
public record NwcConnection(String walletPubkey, String relayUrl, String secret) {

    static final String SCHEME = "nostr+walletconnect";

    public static NwcConnection parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME + "://")) {
            throw new IllegalArgumentException("Wallet URI must start with " + SCHEME + "://");
        }
        UriComponents components = UriComponentsBuilder.fromUriString(uri).build();
        String walletPubkey = components.getHost();
        MultiValueMap<String, String> params = components.getQueryParams();
        String relay = decode(params.getFirst("relay"));
        String secret = decode(params.getFirst("secret"));
        if (!NostrIds.isHex64(walletPubkey)) {
            throw new IllegalArgumentException("Wallet URI does not name a wallet public key");
        }
        if (relay == null || relay.isBlank() || secret == null || !NostrIds.isHex64(secret)) {
            throw new IllegalArgumentException("Wallet URI is missing its relay or secret");
        }
        return new NwcConnection(walletPubkey.toLowerCase(Locale.ROOT), relay, secret);
    }

    private static String decode(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "NwcConnection[walletPubkey=" + walletPubkey + ", relayUrl=" + relayUrl + "]";
    }
}
