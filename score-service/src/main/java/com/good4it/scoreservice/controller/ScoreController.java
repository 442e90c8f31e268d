package com.good4it.scoreservice.controller;

import com.good4it.scoreservice.dto.ScoreDeltaRequest;
import com.good4it.scoreservice.dto.ScoreDeltaResult;
import com.good4it.scoreservice.dto.ScoreHistoryResponse;
import com.good4it.scoreservice.dto.ScoreResponse;
import com.good4it.scoreservice.service.ScoreLedgerService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/scores")
public class ScoreController {

    private final ScoreLedgerService scoreLedgerService;

    public ScoreController(ScoreLedgerService scoreLedgerService) {
        this.scoreLedgerService = scoreLedgerService;
    }

    @PostMapping("/{userId}/deltas")
    public ResponseEntity<ScoreDeltaResult> applyDelta(
            @PathVariable UUID userId,
            @RequestBody @Valid ScoreDeltaRequest request
    ) {
        return new ResponseEntity<>(scoreLedgerService.applyScoreDelta(userId, request), HttpStatus.CREATED);
    }

    @GetMapping("/{userId}")
    public ResponseEntity<ScoreResponse> getScore(@PathVariable UUID userId) {
        return ResponseEntity.ok(scoreLedgerService.getScore(userId));
    }

    @GetMapping("/{userId}/history")
    public ResponseEntity<List<ScoreHistoryResponse>> getHistory(
            @PathVariable UUID userId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since
    ) {
        return ResponseEntity.ok(scoreLedgerService.getHistory(userId, limit, since).stream()
                .map(ScoreHistoryResponse::from)
                .toList());
    }
}
