package com.relayauthority.control;

import com.relayauthority.authority.BootstrapTracker;
import com.relayauthority.authority.Denylist;
import com.relayauthority.authority.IdentityList;
import com.relayauthority.authority.SigningAuthority;
import com.relayauthority.config.AuthorityProperties;
import com.relayauthority.registry.NameRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AuthorityController {

    public record ConfigResponse(String appRelay, String appPublicKey, String domain) {
    }

    public record StatsResponse(String state, int admins, int editors, int denylisted, int activeAliases) {
    }

    private final AuthorityProperties properties;
    private final SigningAuthority authority;
    private final BootstrapTracker bootstrap;
    private final IdentityList admins;
    private final IdentityList editors;
    private final Denylist denylist;
    private final NameRegistry registry;

    public AuthorityController(AuthorityProperties properties, SigningAuthority authority, BootstrapTracker bootstrap,
                               @Qualifier("admins") IdentityList admins, @Qualifier("editors") IdentityList editors,
                               Denylist denylist, NameRegistry registry) {
        this.properties = properties;
        this.authority = authority;
        this.bootstrap = bootstrap;
        this.admins = admins;
        this.editors = editors;
        this.denylist = denylist;
        this.registry = registry;
    }

    /** Public settings clients need to address the authority. */
    @GetMapping("/config")
    public ConfigResponse config() {
        return new ConfigResponse(properties.relay().url(), authority.identity(), properties.domain());
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return new StatsResponse(bootstrap.state().name(), admins.size(), editors.size(), denylist.size(),
                registry.activeRecords().size());
    }
}
