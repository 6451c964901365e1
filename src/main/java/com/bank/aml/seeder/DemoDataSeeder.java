package com.bank.aml.seeder;

import com.bank.aml.config.MonitoringConfig;
import com.bank.aml.model.AssetClass;
import com.bank.aml.model.Transaction;
import com.bank.aml.repository.TransactionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeds the active store with demo transactions for local runs.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=fiat,seed
 *
 * Besides ordinary traffic the data contains one of each pattern the rules look for:
 * a large transfer, a risk-listed counterparty, a burst from one source, a round
 * amount, a fan-out cluster, and a handful of rows older than the retention window.
 */
@Component
@Profile("seed")
@Order(1)
public class DemoDataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoDataSeeder.class);

    private static final int NORMAL_TXNS = 40;

    private final TransactionStore transactionStore;
    private final MonitoringConfig config;
    private final Clock clock;
    private final Random random = new Random(42); // fixed seed for reproducibility

    private int sequence;

    public DemoDataSeeder(TransactionStore transactionStore, MonitoringConfig config, Clock clock) {
        this.transactionStore = transactionStore;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting demo data seeding ({}) ===", config.getAssetClass());

        List<Transaction> txns = new ArrayList<>();
        long now = clock.millis();

        for (int i = 0; i < NORMAL_TXNS; i++) {
            long ts = now - Duration.ofHours(random.nextInt(72)).toMillis() - random.nextInt(3_600_000);
            txns.add(txn(entity("SRC", random.nextInt(15)), entity("DST", random.nextInt(25)),
                    randomAmount(50, 4_000), ts));
        }

        // Large transfer
        txns.add(txn(entity("SRC", 1), entity("DST", 2), new BigDecimal("25750.40"), now - 60_000));

        // Risk-listed counterparty
        String listed = config.getRiskList().stream().findFirst().orElse(entity("DST", 99));
        txns.add(txn(entity("SRC", 3), listed, randomAmount(200, 900), now - 120_000));

        // Burst from one source, 30 seconds apart
        for (int i = 0; i < 4; i++) {
            txns.add(txn(entity("SRC", 4), entity("DST", 5), randomAmount(100, 500), now - 600_000 + i * 30_000L));
        }

        // Round amount
        txns.add(txn(entity("SRC", 6), entity("DST", 7), config.getRoundAmountUnit().multiply(BigDecimal.valueOf(5)),
                now - 180_000));

        // Fan-out cluster: one hub sending to more entities than the cluster limit
        for (int i = 0; i <= config.getClusterSizeLimit() + 1; i++) {
            txns.add(txn(entity("HUB", 0), entity("MULE", i), randomAmount(900, 990), now - 240_000 + i * 1_000L));
        }

        // Past the retention window
        long expired = now - Duration.ofDays(config.getRetentionDays() + 5L).toMillis();
        for (int i = 0; i < 3; i++) {
            txns.add(txn(entity("SRC", 8), entity("DST", 9), randomAmount(100, 300), expired - i * 60_000L));
        }

        txns.forEach(transactionStore::save);
        log.info("=== Demo data seeding complete: {} transactions ===", txns.size());
    }

    private Transaction txn(String source, String destination, BigDecimal amount, long timestamp) {
        sequence++;
        boolean fiat = config.getAssetClass() == AssetClass.FIAT;
        return Transaction.builder()
                .txnId(String.format("DEMO-%s-%06d", config.getAssetClass(), sequence))
                .sourceEntity(source)
                .destinationEntity(destination)
                .amount(amount)
                .timestamp(timestamp)
                .jurisdiction(fiat ? "US" : "ethereum")
                .assetClass(config.getAssetClass())
                .txnType(fiat ? "WIRE" : null)
                .fee(fiat ? null : randomAmount(1, 15))
                .reviewed(false)
                .build();
    }

    private String entity(String role, int n) {
        return config.getAssetClass() == AssetClass.FIAT
                ? String.format("%s-ACCT-%03d", role, n)
                : String.format("0x%s%036d", role.toLowerCase(), n);
    }

    private BigDecimal randomAmount(int min, int max) {
        double value = min + random.nextDouble() * (max - min);
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
