package com.work.chainexec.txmgr.service.gas;

import com.work.chainexec.core.chain.ChainRpcClient;
import com.work.chainexec.txmgr.config.TxMgrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * gas 准入控制：绝对上限 + 滑动窗口涨幅。
 *
 * <p>每次检查都会把当前价格记入历史；窗口外的样本被丢弃，涨幅以窗口内最早样本为基准。
 * 价格查询本身失败时放行，由后续发送阶段自行暴露节点问题。</p>
 */
public class GasSpikeGuard {

    private static final Logger log = LoggerFactory.getLogger(GasSpikeGuard.class);

    private static final BigDecimal WEI_PER_GWEI = BigDecimal.TEN.pow(9);

    private final ChainRpcClient chain;
    private final long maxGasPriceGwei;
    private final double spikeThresholdPercent;
    private final Duration window;
    private final Clock clock;

    private final Deque<Sample> history = new ArrayDeque<>();

    public GasSpikeGuard(ChainRpcClient chain, TxMgrProperties props, Clock clock) {
        this.chain = requireNonNull(chain, "chain");
        requireNonNull(props, "props");
        this.maxGasPriceGwei = props.getMaxGasPriceGwei();
        this.spikeThresholdPercent = props.getSpikeThresholdPercent();
        this.window = requireNonNull(props.getSpikeCheckWindow(), "spikeCheckWindow");
        this.clock = requireNonNull(clock, "clock");
    }

    public GasAdmission check() {
        BigInteger price;
        try {
            price = chain.getGasPrice();
        } catch (RuntimeException e) {
            log.warn("gas price check failed, admitting transaction err={}", e.toString());
            return GasAdmission.allow(null);
        }
        if (price == null) {
            return GasAdmission.allow(null);
        }

        Instant now = clock.instant();
        BigInteger oldest;
        synchronized (history) {
            history.addLast(new Sample(now, price));
            Instant cutoff = now.minus(window);
            while (!history.isEmpty() && !history.peekFirst().at.isAfter(cutoff)) {
                history.removeFirst();
            }
            oldest = history.size() > 1 ? history.peekFirst().price : null;
        }

        BigDecimal gwei = toGwei(price);
        if (gwei.compareTo(BigDecimal.valueOf(maxGasPriceGwei)) > 0) {
            return GasAdmission.reject(price, "Gas price " + gwei.stripTrailingZeros().toPlainString()
                    + " Gwei exceeds maximum " + maxGasPriceGwei + " Gwei");
        }
        if (oldest != null && oldest.signum() > 0) {
            double increase = new BigDecimal(price.subtract(oldest))
                    .multiply(BigDecimal.valueOf(100))
                    .divide(new BigDecimal(oldest), 4, RoundingMode.HALF_UP)
                    .doubleValue();
            if (increase > spikeThresholdPercent) {
                return GasAdmission.reject(price,
                        "Gas price increased by " + String.format(Locale.ROOT, "%.1f", increase) + "% in recent window");
            }
        }
        return GasAdmission.allow(price);
    }

    int historySize() {
        synchronized (history) {
            return history.size();
        }
    }

    static BigDecimal toGwei(BigInteger wei) {
        return new BigDecimal(wei).divide(WEI_PER_GWEI, 9, RoundingMode.HALF_UP);
    }

    private static final class Sample {
        private final Instant at;
        private final BigInteger price;

        private Sample(Instant at, BigInteger price) {
            this.at = at;
            this.price = price;
        }
    }
}
