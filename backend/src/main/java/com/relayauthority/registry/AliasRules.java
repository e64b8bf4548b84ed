package com.relayauthority.registry;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Alias syntax and the reserved route names that can never be registered.
 */
public final class AliasRules {

    private static final Pattern ALIAS = Pattern.compile("^[a-z0-9][a-z0-9_-]{1,28}[a-z0-9]$");

    static final Set<String> RESERVED = Set.of(
            "about", "account", "admin", "api", "app", "assets", "blog", "c", "cart", "checkout",
            "collection", "collections", "community", "dashboard", "docs", "favicon", "help", "images",
            "login", "logout", "nostr", "p", "post", "posts", "privacy", "product", "products", "profile",
            "public", "register", "robots", "search", "settings", "setup", "signin", "signup", "sitemap",
            "static", "status", "support", "terms", "user", "users");

    private AliasRules() {
    }

    public static String normalize(String alias) {
        return alias == null ? "" : alias.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String alias) {
        return ALIAS.matcher(normalize(alias)).matches();
    }

    public static boolean isReserved(String alias) {
        return RESERVED.contains(normalize(alias));
    }
}
