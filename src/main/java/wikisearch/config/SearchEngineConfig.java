package wikisearch.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import lombok.Getter;
import lombok.Setter;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch connection settings and client.
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "wiki.search")
public class SearchEngineConfig {
    private boolean enabled = true;
    private String host = "localhost";
    private int port = 9200;
    private String scheme = "http";
    private String username = "elastic";
    private String password = "changeme";
    private String indexName = "pages";
    private int maxHits = 10;
    private int snippetLength = 200;

    @Bean(destroyMethod = "close")
    public RestClient elasticsearchRestClient() {
        RestClientBuilder clientBuilder = RestClient.builder(new HttpHost(host, port, scheme));

        if (username != null && !username.isBlank()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(username, password));
            clientBuilder.setHttpClientConfigCallback(httpClientBuilder ->
                    httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider));
        }

        return clientBuilder.build();
    }

    @Bean
    public ElasticsearchClient elasticsearchClient(RestClient elasticsearchRestClient) {
        RestClientTransport transport = new RestClientTransport(elasticsearchRestClient, new JacksonJsonpMapper());
        return new ElasticsearchClient(transport);
    }
}
