package com.domain.correlation.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in noise rules for identifiers that are shared by unrelated domains
 * because they use the same platform, CDN, registrar or mail provider.
 */
public final class DefaultNoiseRules {

    private DefaultNoiseRules() {
        // Utility class
    }

    /**
     * Creates a NoiseFilter with all default rules.
     */
    public static NoiseFilter createDefaultFilter() {
        List<NoiseRule> rules = new ArrayList<>();
        rules.addAll(getPlatformRules());
        rules.addAll(getEmailRules());
        rules.addAll(getNameserverRules());
        rules.addAll(getRegistrantRules());
        rules.addAll(getVerificationTokenRules());
        return NoiseFilter.of(rules);
    }

    /**
     * CDN and shared front-end assets. Applies to every identifier type.
     */
    public static List<NoiseRule> getPlatformRules() {
        return List.of(
                NoiseRule.builder()
                        .name("platform-cdn")
                        .pattern("cloudflare|akamai|fastly|cloudfront|amazonaws\\.com")
                        .priority(10)
                        .build(),

                NoiseRule.builder()
                        .name("platform-google-static")
                        .pattern("googleapis\\.com|gstatic\\.com|google-analytics\\.com")
                        .priority(10)
                        .build(),

                NoiseRule.builder()
                        .name("platform-frontend-libraries")
                        .pattern("bootstrapcdn|jquery|fontawesome|gravatar\\.com")
                        .priority(10)
                        .build(),

                NoiseRule.builder()
                        .name("platform-wordpress-paths")
                        .pattern("wp-content|wp-includes")
                        .priority(10)
                        .build()
        );
    }

    /**
     * Free mail providers, role mailboxes, registrar and privacy-proxy contacts.
     */
    public static List<NoiseRule> getEmailRules() {
        return List.of(
                NoiseRule.builder()
                        .name("email-free-provider")
                        .pattern("@(gmail\\.com|yahoo\\.|hotmail\\.|outlook\\.|aol\\.com|protonmail\\.|icloud\\.com"
                                + "|live\\.com|msn\\.com|mail\\.com|ymail\\.com|qq\\.com|163\\.com|126\\.com|daum\\.net)")
                        .identifierTypes("email")
                        .priority(20)
                        .build(),

                NoiseRule.builder()
                        .name("email-role-mailbox")
                        .pattern("^(abuse|admin|webmaster|hostmaster|noreply|no-reply|support|info|postmaster"
                                + "|security|contact|help|sales|billing|legal|privacy|dns|noc|registry|registrar"
                                + "|domains?|whois|cert|csirt|trustandsafety|compliance|dmca)@")
                        .identifierTypes("email")
                        .priority(20)
                        .build(),

                NoiseRule.builder()
                        .name("email-abuse-contact")
                        .pattern("abuse.*@|-(admin|registrant|tech)@|tld@")
                        .identifierTypes("email")
                        .priority(20)
                        .build(),

                NoiseRule.builder()
                        .name("email-registrar")
                        .pattern("@(markmonitor\\.com|godaddy\\.com|namecheap\\.com|enom\\.com|gandi\\.net"
                                + "|networksolutions\\.com|register\\.com|tucows\\.com|publicdomainregistry\\.com"
                                + "|name\\.com|hover\\.com|dynadot\\.com|porkbun\\.com|epik\\.com|ionos\\.|1and1\\."
                                + "|key-systems\\.net|domaincontrol\\.com|cscglobal\\.com|eurodns\\.com|opensrs\\.com)$")
                        .identifierTypes("email")
                        .priority(20)
                        .build(),

                NoiseRule.builder()
                        .name("email-privacy-proxy")
                        .pattern("whoisprotect|privacyprotect|domainprivacy|contactprivacy|whoisprivacy|proxy@"
                                + "|withheldforprivacy\\.com|@anonymised\\.email$")
                        .identifierTypes("email")
                        .priority(20)
                        .build(),

                NoiseRule.builder()
                        .name("email-hosting-provider")
                        .pattern("@(microsoft\\.com|azure\\.com|google\\.com|digitalocean\\.com|linode\\.com"
                                + "|vultr\\.com|ovh\\.|hetzner\\.|hostgator\\.com|bluehost\\.com|siteground\\.com"
                                + "|dreamhost\\.com|secureserver\\.net|wix\\.com|squarespace\\.com|shopify\\.com"
                                + "|wordpress\\.com|zendesk\\.com)$")
                        .identifierTypes("email")
                        .priority(20)
                        .build(),

                NoiseRule.builder()
                        .name("email-registry")
                        .pattern("@(verisign\\.com|icann\\.org|iana\\.org|apnic\\.net|arin\\.net|ripe\\.net"
                                + "|lacnic\\.net|afrinic\\.net)$|@nic\\.[a-z]{2,}$")
                        .identifierTypes("email")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Managed DNS providers whose nameservers are shared by millions of customers.
     */
    public static List<NoiseRule> getNameserverRules() {
        return List.of(
                NoiseRule.builder()
                        .name("nameserver-managed-dns")
                        .pattern("cloudflare|awsdns|google|registrar|domaincontrol|godaddy|namecheap|hostgator")
                        .identifierTypes("nameserver")
                        .priority(30)
                        .build()
        );
    }

    /**
     * Privacy-protected WHOIS registrants.
     */
    public static List<NoiseRule> getRegistrantRules() {
        return List.of(
                NoiseRule.builder()
                        .name("registrant-privacy")
                        .pattern("privacy|redacted|data protected|withheld|domains by proxy|whoisguard")
                        .identifierTypes("whois_registrant", "registrant_contact")
                        .priority(30)
                        .build()
        );
    }

    /**
     * Verification tokens owned by cloud providers that leak into customer scans
     * through DNS chains.
     */
    public static List<NoiseRule> getVerificationTokenRules() {
        return List.of(
                NoiseRule.builder()
                        .name("verification-provider-google")
                        .pattern("EEVHeL7fVZb5ix5bR0draHWtJ5MfS0538OwXAfY8|qF4YFDz-nQ_gKOOlNIxI0rC79sLnCbrUMF9fmKlj"
                                + "|cW7L-_2lD9bWyDxO79sYTdr0tKphk1quplaAfLS3pjY")
                        .identifierTypes("google_site_verification")
                        .priority(40)
                        .build(),

                NoiseRule.builder()
                        .name("verification-provider-atlassian")
                        .pattern("ZT4AapXgobCpXIWoNcd7gtMjZyOUdr4EDFMnFUWr")
                        .identifierTypes("atlassian_verification")
                        .priority(40)
                        .build()
        );
    }
}
