package com.digitalasset.ammpool.service;

import com.digitalasset.ammpool.engine.PoolDetails;
import com.digitalasset.ammpool.engine.PoolEvent;
import com.digitalasset.ammpool.engine.PoolEventListener;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Bounded, newest-first history of committed pool events.
 *
 * When {@code ammpool.history.path} is set the history is loaded from that JSON file at
 * start-up and rewritten after every append.
 */
@Service
public class TransactionHistoryService implements PoolEventListener {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionHistoryService.class);
    private final Deque<TransactionHistoryEntry> history = new ArrayDeque<>();
    private final ObjectMapper mapper = new ObjectMapper();
    private final int maxRecords;
    private final String historyPath;

    public TransactionHistoryService(@Value("${ammpool.history.max-records:1000}") int maxRecords,
                                     @Value("${ammpool.history.path:}") String historyPath) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("ammpool.history.max-records must be positive, got: " + maxRecords);
        }
        this.maxRecords = maxRecords;
        this.historyPath = historyPath;
    }

    @PostConstruct
    public void init() {
        loadHistory();
    }

    @Override
    public synchronized void onPoolEvent(PoolEvent event) {
        TransactionHistoryEntry entry = baseEntry(event);
        if (event instanceof PoolEvent.LiquidityProvided provided) {
            entry.amountToken1 = format(provided.amountToken1());
            entry.amountToken2 = format(provided.amountToken2());
            entry.shareAmount = format(provided.sharesMinted());
            entry.genesis = provided.genesis();
        } else if (event instanceof PoolEvent.LiquidityWithdrawn withdrawn) {
            entry.amountToken1 = format(withdrawn.amountToken1());
            entry.amountToken2 = format(withdrawn.amountToken2());
            entry.shareAmount = format(withdrawn.sharesBurned());
        } else if (event instanceof PoolEvent.FaucetCredited credited) {
            entry.amountToken1 = format(credited.amountToken1());
            entry.amountToken2 = format(credited.amountToken2());
            entry.shareAmount = "0";
        }
        append(entry);
    }

    public synchronized List<TransactionHistoryEntry> getRecent(int limit) {
        int size = Math.max(0, Math.min(limit, history.size()));
        List<TransactionHistoryEntry> list = new ArrayList<>(size);
        for (TransactionHistoryEntry entry : history) {
            if (list.size() >= size) {
                break;
            }
            list.add(entry);
        }
        return list;
    }

    public synchronized int size() {
        return history.size();
    }

    private void append(TransactionHistoryEntry entry) {
        history.addFirst(entry);
        while (history.size() > maxRecords) {
            history.removeLast();
        }
        persistHistory();
    }

    private static TransactionHistoryEntry baseEntry(PoolEvent event) {
        PoolDetails after = event.poolAfter();
        TransactionHistoryEntry entry = new TransactionHistoryEntry();
        entry.id = UUID.randomUUID().toString();
        entry.type = event.type().name();
        entry.callerId = event.caller().value();
        entry.createdAt = DateTimeFormatter.ISO_INSTANT.format(Instant.now());
        entry.totalToken1After = format(after.totalToken1());
        entry.totalToken2After = format(after.totalToken2());
        entry.totalSharesAfter = format(after.totalShares());
        return entry;
    }

    private static String format(BigInteger value) {
        return value == null ? "0" : value.toString();
    }

    private synchronized void loadHistory() {
        if (historyPath == null || historyPath.isBlank()) {
            return;
        }
        Path path = Paths.get(historyPath);
        if (!Files.exists(path)) {
            return;
        }
        try {
            byte[] raw = Files.readAllBytes(path);
            List<TransactionHistoryEntry> stored = mapper.readValue(raw, new TypeReference<List<TransactionHistoryEntry>>() {});
            history.clear();
            for (TransactionHistoryEntry entry : stored) {
                if (history.size() >= maxRecords) {
                    break;
                }
                history.addLast(entry);
            }
            LOG.info("Loaded {} history entries from {}", history.size(), historyPath);
        } catch (IOException e) {
            LOG.warn("Failed to load transaction history from {}: {}", historyPath, e.getMessage());
        }
    }

    private void persistHistory() {
        if (historyPath == null || historyPath.isBlank()) {
            return;
        }
        Path path = Paths.get(historyPath);
        try {
            Path parent = path.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            byte[] payload = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(new ArrayList<>(history));
            Files.write(path, payload);
        } catch (IOException e) {
            LOG.warn("Failed to persist transaction history to {}: {}", historyPath, e.getMessage());
        }
    }

    public static class TransactionHistoryEntry {
        public String id;
        public String type;
        public String callerId;
        public String createdAt;
        public String amountToken1;
        public String amountToken2;
        public String shareAmount;
        public boolean genesis;
        public String totalToken1After;
        public String totalToken2After;
        public String totalSharesAfter;

        public TransactionHistoryEntry() {}
    }
}
