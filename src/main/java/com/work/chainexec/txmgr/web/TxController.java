package com.work.chainexec.txmgr.web;

import com.work.chainexec.txmgr.domain.TransactionMetadata;
import com.work.chainexec.txmgr.domain.TxState;
import com.work.chainexec.txmgr.service.SubmissionPipeline;
import com.work.chainexec.txmgr.service.SubmissionStatistics;
import com.work.chainexec.txmgr.service.TransactionOptions;
import com.work.chainexec.txmgr.service.TransactionResult;
import com.work.chainexec.txmgr.web.dto.CreateTxRequest;
import com.work.chainexec.txmgr.web.dto.ReplaceTxRequest;
import com.work.chainexec.txmgr.web.dto.TxView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 单链交易接口：同步执行到终态；TIMEOUT 返回 202，调用方可继续轮询。
 */
@RestController
@RequestMapping("/api/v1/tx")
public class TxController {

    private final SubmissionPipeline pipeline;

    public TxController(SubmissionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping
    public ResponseEntity<TxView> create(@Validated @RequestBody CreateTxRequest req) {
        TransactionOptions options = TransactionOptions.defaults()
                .value(req.getValue())
                .gasLimit(req.getGasLimit())
                .gasPrice(req.getGasPrice())
                .eip1559(req.getMaxFeePerGas(), req.getMaxPriorityFeePerGas())
                .maxRetries(req.getMaxRetries());
        TransactionResult result = pipeline.executeTransaction(req.getTo(), req.getData(), options);
        return toResponse(result);
    }

    @GetMapping("/stats")
    public SubmissionStatistics stats() {
        return pipeline.getStatistics();
    }

    @GetMapping("/{txId}")
    public ResponseEntity<TxView> get(@PathVariable String txId) {
        TransactionMetadata metadata = pipeline.getTransactionStatus(txId);
        if (metadata == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toView(metadata, metadata.getState() == TxState.CONFIRMED, metadata.getError()));
    }

    @PostMapping("/{txId}/replace")
    public ResponseEntity<TxView> replace(@PathVariable String txId, @Validated @RequestBody ReplaceTxRequest req) {
        if (pipeline.getTransactionStatus(txId) == null) {
            return ResponseEntity.notFound().build();
        }
        return toResponse(pipeline.replaceTransaction(txId, req.getGasPrice()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }

    private ResponseEntity<TxView> toResponse(TransactionResult result) {
        TransactionMetadata metadata = result.getMetadata();
        if (metadata == null) {
            TxView v = new TxView();
            v.setError(result.getError());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(v);
        }
        TxView view = toView(metadata, result.isSuccess(), result.getError());
        if (metadata.getState() == TxState.TIMEOUT) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(view);
        }
        return ResponseEntity.ok(view);
    }

    private TxView toView(TransactionMetadata m, boolean success, String error) {
        TxView v = new TxView();
        v.setTxId(m.getId().toString());
        v.setSuccess(success);
        v.setState(m.getState().name());
        v.setTxHash(m.getHash());
        v.setNonce(m.getNonce());
        v.setAttempts(m.getAttempts());
        v.setGasPrice(m.getGasPrice());
        v.setGasUsed(m.getGasUsed());
        v.setReplacedBy(m.getReplacedBy());
        v.setError(error);
        v.setSubmittedAt(m.getSubmittedAt());
        v.setConfirmedAt(m.getConfirmedAt());
        return v;
    }
}
