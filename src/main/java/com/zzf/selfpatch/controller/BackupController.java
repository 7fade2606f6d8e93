package com.zzf.selfpatch.controller;

import com.zzf.selfpatch.api.ApiException;
import com.zzf.selfpatch.snapshot.BackupStore;
import com.zzf.selfpatch.snapshot.RestoreResult;
import com.zzf.selfpatch.snapshot.SnapshotInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/backups")
@RequiredArgsConstructor
public class BackupController {

    private final BackupStore backupStore;

    @GetMapping
    public List<SnapshotInfo> list() {
        return backupStore.listSnapshots();
    }

    @PostMapping
    public Map<String, Object> create() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", backupStore.snapshot());
        return response;
    }

    @PostMapping("/{timestamp}/restore")
    public RestoreResult restore(@PathVariable("timestamp") long timestamp) {
        RestoreResult result = backupStore.restore(timestamp);
        if (!result.isFound()) {
            throw ApiException.notFound("BACKUP_NOT_FOUND", result.getMessage());
        }
        return result;
    }

    @PostMapping("/rollback")
    public RestoreResult rollback(@RequestParam(name = "index", defaultValue = "0") int index) {
        RestoreResult result = backupStore.rollback(index);
        if (!result.isFound()) {
            throw ApiException.notFound("BACKUP_NOT_FOUND", result.getMessage());
        }
        return result;
    }

    @PostMapping("/prune")
    public Map<String, Object> prune(@RequestParam(name = "maxKeep") int maxKeep) {
        if (maxKeep < 0) {
            throw new ApiException("INVALID_MAX_KEEP", "maxKeep must be >= 0");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("removed", backupStore.prune(maxKeep));
        return response;
    }
}
