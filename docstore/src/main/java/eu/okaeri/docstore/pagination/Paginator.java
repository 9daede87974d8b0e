package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.document.Document;
import lombok.NonNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

public interface Paginator {

    /**
     * Fetches a single page. Store errors propagate unchanged, no partial page is returned.
     */
    PaginatedResponse<Document> getPage(PageQuery query, PageRequest request);

    /**
     * Fetches a single page on the given executor. Every call is independent, failures
     * complete the future exceptionally.
     */
    default CompletableFuture<PaginatedResponse<Document>> getPageAsync(@NonNull PageQuery query, @NonNull PageRequest request, @NonNull Executor executor) {
        return CompletableFuture.supplyAsync(() -> this.getPage(query, request), executor);
    }
}
