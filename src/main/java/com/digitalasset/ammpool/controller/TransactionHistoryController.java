package com.digitalasset.ammpool.controller;

import com.digitalasset.ammpool.constants.PoolConstants;
import com.digitalasset.ammpool.service.TransactionHistoryService;
import com.digitalasset.ammpool.service.TransactionHistoryService.TransactionHistoryEntry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/transactions")
public class TransactionHistoryController {

    private final TransactionHistoryService transactionHistoryService;

    public TransactionHistoryController(TransactionHistoryService transactionHistoryService) {
        this.transactionHistoryService = transactionHistoryService;
    }

    @GetMapping("/recent")
    public List<TransactionHistoryEntry> recentTransactions(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        int safeLimit = Math.max(1, Math.min(limit, PoolConstants.MAX_HISTORY_PAGE));
        return transactionHistoryService.getRecent(safeLimit);
    }
}
