package com.relayauthority.registry;

import com.relayauthority.config.AuthorityProperties;
import com.relayauthority.crypto.NostrIds;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * Resolves {@code /<alias>} to the owner's profile on the marketplace front end.
 * Reserved route names and the root pass through to the front end unchanged.
 */
@RestController
public class AliasRouteController {

    private final NameRegistry registry;
    private final String upstreamUrl;

    public AliasRouteController(NameRegistry registry, AuthorityProperties properties) {
        this.registry = registry;
        this.upstreamUrl = stripTrailingSlash(properties.upstreamUrl());
    }

    @GetMapping("/")
    public ResponseEntity<Void> root() {
        return redirect(upstreamUrl);
    }

    @GetMapping("/{alias}")
    public ResponseEntity<Void> route(@PathVariable String alias) {
        if (AliasRules.isReserved(alias)) {
            return redirect(upstreamUrl + "/" + AliasRules.normalize(alias));
        }
        if (!AliasRules.isValid(alias)) {
            return ResponseEntity.notFound().build();
        }
        return registry.resolve(alias)
                .map(owner -> redirect(upstreamUrl + "/p/" + NostrIds.toNpub(owner)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static ResponseEntity<Void> redirect(String location) {
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT).location(URI.create(location)).build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
