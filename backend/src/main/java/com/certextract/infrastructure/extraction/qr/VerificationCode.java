package com.certextract.infrastructure.extraction.qr;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A decoded QR payload, recognised against known certificate-verification services.
 */
public record VerificationCode(Provider provider, String url, String code, String rawData) {

    public enum Provider {
        GAS_SAFE,
        GAS_TAG,
        NICEIC,
        CORGI,
        OTHER
    }

    private record ProviderPattern(Provider provider, Pattern pattern) {}

    private static final List<ProviderPattern> PROVIDER_PATTERNS = List.of(
            new ProviderPattern(Provider.GAS_SAFE, Pattern.compile("gassaferegister\\.co\\.uk/check/(\\w+)", Pattern.CASE_INSENSITIVE)),
            new ProviderPattern(Provider.GAS_TAG, Pattern.compile("gastag\\.co\\.uk/verify/(\\S+)", Pattern.CASE_INSENSITIVE)),
            new ProviderPattern(Provider.NICEIC, Pattern.compile("niceic\\.com/verify/(\\w+)", Pattern.CASE_INSENSITIVE)),
            new ProviderPattern(Provider.CORGI, Pattern.compile("corgi.*\\.co\\.uk.*verify", Pattern.CASE_INSENSITIVE))
    );

    public static VerificationCode parse(String rawData) {
        String url = rawData.startsWith("http") ? rawData : null;
        for (ProviderPattern candidate : PROVIDER_PATTERNS) {
            Matcher m = candidate.pattern().matcher(rawData);
            if (m.find()) {
                String code = m.groupCount() >= 1 ? m.group(1) : null;
                return new VerificationCode(candidate.provider(), url, code, rawData);
            }
        }
        return new VerificationCode(Provider.OTHER, url, null, rawData);
    }
}
