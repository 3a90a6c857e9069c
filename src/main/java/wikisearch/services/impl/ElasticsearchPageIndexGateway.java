package wikisearch.services.impl;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.CreateIndexResponse;
import co.elastic.clients.elasticsearch.indices.DeleteIndexRequest;
import co.elastic.clients.elasticsearch.indices.DeleteIndexResponse;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import wikisearch.dto.index.PageDocument;
import wikisearch.services.PageIndexGateway;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

@Slf4j
@Component
@RequiredArgsConstructor
public class ElasticsearchPageIndexGateway implements PageIndexGateway {
    private static final String[] SEARCH_FIELDS = {"title^3", "url^2", "content"};

    private final ElasticsearchClient elasticsearchClient;

    @Override
    public boolean ping() {
        try {
            return elasticsearchClient.ping().value();
        } catch (IOException | ElasticsearchException e) {
            log.warn("Elasticsearch is not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean indexExists(String indexName) throws IOException {
        return elasticsearchClient.indices().exists(ExistsRequest.of(e -> e.index(indexName))).value();
    }

    @Override
    public void deleteIndex(String indexName) throws IOException {
        DeleteIndexResponse response = elasticsearchClient.indices().delete(DeleteIndexRequest.of(d -> d.index(indexName)));
        if (!response.acknowledged()) {
            throw new IOException("Deletion of index '" + indexName + "' was not acknowledged");
        }
    }

    @Override
    public void createIndex(String indexName) throws IOException {
        CreateIndexRequest request = CreateIndexRequest.of(c -> c
                .index(indexName)
                .mappings(m -> m
                        .properties("title", p -> p.text(t -> t))
                        .properties("url", p -> p.keyword(k -> k))
                        .properties("content", p -> p.text(t -> t))
                        .properties("language", p -> p.keyword(k -> k))
                        .properties("last_updated", p -> p.date(d -> d))));
        CreateIndexResponse response = elasticsearchClient.indices().create(request);
        if (!Boolean.TRUE.equals(response.acknowledged())) {
            throw new IOException("Creation of index '" + indexName + "' was not acknowledged");
        }
    }

    @Override
    public void indexDocument(String indexName, PageDocument document) throws IOException {
        IndexRequest<PageDocument> request = IndexRequest.of(i -> i
                .index(indexName)
                .id(document.getUrl())
                .document(document)
                .refresh(Refresh.True));
        elasticsearchClient.index(request);
    }

    @Override
    public long countDocuments(String indexName) throws IOException {
        return elasticsearchClient.count(CountRequest.of(c -> c.index(indexName))).count();
    }

    @Override
    public List<PageDocument> search(String indexName, String query, int maxHits) throws IOException {
        SearchRequest request = SearchRequest.of(s -> s
                .index(indexName)
                .size(maxHits)
                .query(q -> q.multiMatch(m -> m
                        .query(query)
                        .fields(List.of(SEARCH_FIELDS)))));
        SearchResponse<PageDocument> response = elasticsearchClient.search(request, PageDocument.class);

        return response.hits().hits().stream()
                .map(Hit::source)
                .filter(Objects::nonNull)
                .toList();
    }
}
