package com.work.chainexec.relay.web;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.core.chain.TxRequest;
import com.work.chainexec.relay.PrivateTxOptions;
import com.work.chainexec.relay.PrivateTxResult;
import com.work.chainexec.relay.RelayConfig;
import com.work.chainexec.relay.RelayStats;
import com.work.chainexec.relay.RelaySubmitter;
import com.work.chainexec.relay.RelayType;
import com.work.chainexec.relay.bundle.BundleStatus;
import com.work.chainexec.relay.web.dto.PrivateTxRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 私有 relay 接口：私有交易提交 / 取消，relay 启停，bundle 状态查询。
 */
@RestController
@RequestMapping("/api/v1/relay")
public class RelayController {

    private final RelaySubmitter submitter;
    private final ChainRpcClient chain;

    public RelayController(RelaySubmitter submitter, ChainRpcClient chain) {
        this.submitter = submitter;
        this.chain = chain;
    }

    @GetMapping
    public List<RelayConfig> relays() {
        return submitter.getRegistry().all();
    }

    @GetMapping("/stats")
    public Map<RelayType, RelayStats> stats() {
        return submitter.getStats();
    }

    @PostMapping("/{type}/enable")
    public ResponseEntity<Void> enable(@PathVariable RelayType type) {
        return submitter.getRegistry().enable(type) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/{type}/disable")
    public ResponseEntity<Void> disable(@PathVariable RelayType type) {
        return submitter.getRegistry().disable(type) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/private-tx")
    public ResponseEntity<PrivateTxResult> submitPrivate(@Validated @RequestBody PrivateTxRequest req) {
        BigInteger gasPrice = req.getGasPrice() != null ? req.getGasPrice() : chain.getGasPrice();
        TxRequest tx = TxRequest.builder()
                .to(req.getTo())
                .data(req.getData())
                .value(req.getValue())
                .gasLimit(req.getGasLimit())
                .gasPrice(gasPrice)
                .build();
        PrivateTxOptions options = PrivateTxOptions.defaults()
                .privacyLevel(req.getPrivacyLevel())
                .preferredRelay(req.getPreferredRelay())
                .fastMode(req.isFastMode())
                .allowPublicFallback(req.isAllowPublicFallback());
        PrivateTxResult result = submitter.submitPrivateTransaction(tx, options);
        if (!result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/private-tx/{txHash}/cancel")
    public Map<String, Boolean> cancelPrivate(@PathVariable String txHash) {
        return Collections.singletonMap("cancelled", submitter.cancelPrivateTransaction(txHash));
    }

    @GetMapping("/bundles/{bundleHash}")
    public BundleStatus bundleStatus(@PathVariable String bundleHash) {
        return submitter.getBundleStatus(bundleHash);
    }

    @PostMapping("/bundles/{bundleHashOrUuid}/cancel")
    public Map<String, Boolean> cancelBundle(@PathVariable String bundleHashOrUuid) {
        return Collections.singletonMap("cancelled", submitter.cancelBundle(bundleHashOrUuid));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }
}
