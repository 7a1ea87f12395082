package com.scratchsync.infrastructure.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scratchsync.domain.model.AssetKind;
import com.scratchsync.domain.model.CatalogEntity;
import com.scratchsync.domain.model.CatalogScrape;
import com.scratchsync.domain.ports.CatalogScraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scraper for upstreams that already publish their catalog as a JSON listing.
 *
 * Every item becomes an entity carrying all of the item's fields; the configured image fields
 * are mapped onto the ticket and odds asset attributes.
 */
@Component
@ConditionalOnProperty(name = "catalog.feed.url")
public class JsonFeedCatalogScraper implements CatalogScraper {

    private static final Logger logger = LoggerFactory.getLogger(JsonFeedCatalogScraper.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "application/json, text/plain, */*",
        "accept-language", "en-US,en;q=0.9",
        "user-agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
    );

    private final String feedUrl;
    private final String catalog;
    private final String itemsField;
    private final String idField;
    private final String endedField;
    private final String ticketField;
    private final String oddsField;

    public JsonFeedCatalogScraper(
            @Value("${catalog.feed.url}") String feedUrl,
            @Value("${catalog.feed.catalog:feed/scratchers}") String catalog,
            @Value("${catalog.feed.items-field:games}") String itemsField,
            @Value("${catalog.feed.id-field:gameNumber}") String idField,
            @Value("${catalog.feed.ended-field:ended}") String endedField,
            @Value("${catalog.feed.ticket-field:ticketImageUrl}") String ticketField,
            @Value("${catalog.feed.odds-field:oddsImageUrl}") String oddsField) {
        this.feedUrl = feedUrl;
        this.catalog = catalog;
        this.itemsField = itemsField;
        this.idField = idField;
        this.endedField = endedField;
        this.ticketField = ticketField;
        this.oddsField = oddsField;
    }

    @Override
    public String getName() {
        return catalog;
    }

    @Override
    public CatalogScrape scrape() throws Exception {
        logger.info("Fetching {} listing from {}", catalog, feedUrl);
        JsonNode root = HttpClientUtil.getJson(feedUrl, HEADERS);

        JsonNode items = root.isArray() ? root : root.path(itemsField);
        if (!items.isArray()) {
            throw new IOException("Listing has no '" + itemsField + "' array");
        }

        List<CatalogEntity> entities = new ArrayList<>();
        Set<String> endedIds = new LinkedHashSet<>();
        for (JsonNode item : items) {
            try {
                CatalogEntity entity = toEntity(item);
                if (entity == null) {
                    continue;
                }
                if (item.path(endedField).asBoolean(false)) {
                    endedIds.add(entity.getId());
                } else {
                    entities.add(entity);
                }
            } catch (Exception e) {
                logger.error("Error mapping {} item", catalog, e);
            }
        }

        logger.info("Mapped {} live and {} ended {} entities", entities.size(), endedIds.size(), catalog);
        return new CatalogScrape(catalog, entities, endedIds, Map.of(itemsField, items.size()));
    }

    CatalogEntity toEntity(JsonNode item) throws IOException {
        String id = item.path(idField).asText("").trim();
        if (id.isEmpty()) {
            logger.warn("Skipping {} item without '{}'", catalog, idField);
            return null;
        }

        CatalogEntity entity = new CatalogEntity(id);
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (name.equals(idField) || name.equals(endedField) || name.equals("id")) {
                continue;
            }
            entity.setAttribute(name, objectMapper.treeToValue(field.getValue(), Object.class));
        }

        moveAsset(entity, ticketField, AssetKind.TICKET);
        moveAsset(entity, oddsField, AssetKind.ODDS);
        return entity;
    }

    private static void moveAsset(CatalogEntity entity, String field, AssetKind kind) {
        if (field.equals(kind.getAttribute())) {
            return;
        }
        String url = entity.getStringAttribute(field);
        entity.removeAttribute(field);
        if (url != null) {
            entity.setAssetUrl(kind, url);
        }
    }
}
