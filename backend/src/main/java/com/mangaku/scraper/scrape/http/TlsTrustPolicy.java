package com.mangaku.scraper.scrape.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;

/**
 * Builds the SSL context used by the transport. Certificate validation is only skipped when
 * {@code scraper.http.trust-all-certificates} is switched on explicitly.
 */
final class TlsTrustPolicy {
    private static final Logger log = LoggerFactory.getLogger(TlsTrustPolicy.class);
    private static final String DISABLE_HOSTNAME_VERIFICATION = "jdk.internal.httpclient.disableHostnameVerification";

    private TlsTrustPolicy() {
    }

    static SSLContext sslContext(boolean trustAllCertificates) {
        try {
            if (!trustAllCertificates) {
                return SSLContext.getDefault();
            }
            log.warn("TLS certificate and hostname verification are disabled for upstream requests");
            System.setProperty(DISABLE_HOSTNAME_VERIFICATION, "true");
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to initialise TLS context", e);
        }
    }

    private static final class TrustAllManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // accepts every client certificate
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // accepts every server certificate
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
