package com.entity.dedup.blocking;

import com.entity.dedup.core.model.Block;
import com.entity.dedup.core.model.BlockKey;
import com.entity.dedup.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups records into candidate blocks under a blocking rule.
 *
 * <p>Every record lands in at least one block: a record for which the rule yields no key
 * forms a singleton block of its own. Blocks are returned in order of first appearance
 * while scanning records by index, so the result is deterministic.</p>
 *
 * <p>A {@code null} rule means no blocking at all: every record goes into a single block.</p>
 */
public class BlockBuilder {
    private static final Logger log = LoggerFactory.getLogger(BlockBuilder.class);

    static final String ALL_RECORDS_BLOCK = "all";

    private final BlockingRule rule;

    public BlockBuilder(BlockingRule rule) {
        this.rule = rule;
    }

    public List<Block> build(List<SourceRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        if (rule == null) {
            return List.of(new Block(ALL_RECORDS_BLOCK, records));
        }

        Map<BlockKey, List<SourceRecord>> groups = new LinkedHashMap<>();
        int unmatched = 0;
        for (SourceRecord record : records) {
            Set<BlockKey> keys = BlockKeys.of(rule, record);
            if (keys.isEmpty()) {
                groups.put(BlockKey.unblocked(record.index()), new ArrayList<>(List.of(record)));
                unmatched++;
                continue;
            }
            for (BlockKey key : keys) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }

        List<Block> blocks = new ArrayList<>(groups.size());
        groups.forEach((key, members) -> blocks.add(new Block(key.toString(), members)));
        log.debug("blocking.built rule={} records={} blocks={} unmatched={}",
                rule.describe(), records.size(), blocks.size(), unmatched);
        return blocks;
    }

    public BlockingRule getRule() {
        return rule;
    }
}
