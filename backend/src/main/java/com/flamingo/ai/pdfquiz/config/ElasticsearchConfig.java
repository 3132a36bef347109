package com.flamingo.ai.pdfquiz.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Elasticsearch client and the layout of the per-document chunk collections.
 *
 * <p>Connection settings come from {@code elasticsearch.*}; collection settings bind from {@code
 * app.elasticsearch.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "app.elasticsearch")
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.username:}")
  private String username;

  @Value("${elasticsearch.password:}")
  private String password;

  /** Must match the embedding model's output size. */
  @Getter @Setter private int vectorDimensions = 1536;

  /** Prepended to the lowercased document id to name its index. */
  @Getter @Setter private String indexPrefix = "pdf_";

  /** Hits fetched per page when a whole collection is scanned. */
  @Getter @Setter private int scanPageSize = 1000;

  /** How long a point in time stays open between two scan pages. */
  @Getter @Setter private String scanKeepAlive = "1m";

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client() {
    Rest5ClientBuilder builder = Rest5Client.builder(new HttpHost(scheme, host, port));
    if (StringUtils.hasText(username)) {
      String credentials = username + ":" + password;
      String token =
          Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "Basic " + token)});
    }
    log.info(
        "Elasticsearch at {}://{}:{}, collections prefixed {}", scheme, host, port, indexPrefix);
    return builder.build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(
      Rest5Client rest5Client, ObjectMapper objectMapper) {
    // the mapper adjusts its own serialization settings, so it gets a copy
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper(objectMapper.copy()));
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}
