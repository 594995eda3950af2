package org.tanzu.proxmoxmcp.config;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.time.Duration;

/**
 * Configuration class for the WebClient used to talk to the Proxmox API.
 * 
 * Proxmox installations usually run with a self-signed certificate, so unless
 * proxmox.verify-ssl is true the client trusts any certificate. The builder is
 * completed (base URL, token header, response buffer limit) by {@link org.tanzu.proxmoxmcp.proxmox.ProxmoxClient}.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder for Proxmox API communication.
     * 
     * @param proxmoxConfig connection settings carrying the SSL flag
     * @return a builder with JSON accept header and the SSL setup applied
     * @throws IllegalStateException if the insecure SSL context cannot be created
     */
    @Bean
    @DependsOn("proxmoxConfigProcessor")
    public WebClient.Builder webClientBuilder(ProxmoxConfig proxmoxConfig) {
        logger.info("Configuring WebClient.Builder for Proxmox: {}:{} (verifySsl={})",
                   proxmoxConfig.getHost(), proxmoxConfig.getPort(), proxmoxConfig.isVerifySsl());

        WebClient.Builder builder = WebClient.builder()
            .defaultHeader("Accept", "application/json");

        HttpClient httpClient = HttpClient.create()
            .responseTimeout(Duration.ofSeconds(60));

        if (!proxmoxConfig.isVerifySsl()) {
            try {
                logger.warn("SSL validation is DISABLED for Proxmox connection (verify-ssl=false). This is not recommended for production!");
                
                SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
                
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
                logger.debug("Created HttpClient with insecure SSL context");
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new IllegalStateException("Failed to configure insecure SSL context", e);
            }
        } else {
            logger.info("Using default SSL validation for Proxmox connection");
        }

        return builder.clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
