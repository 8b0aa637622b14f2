package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.application.runtime.Runtime;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.spi.DataContextTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 오래된 실행 기록 삭제.
 *
 * <p>종료 상태이고 보존 기간이 지난 Metadata를 로그와 함께 삭제합니다. 대상은 설정된 Workflow 이름으로
 * 제한할 수 있습니다. 실행 중인 기록은 건드리지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MetadataCleaner implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(MetadataCleaner.class);

    private final DataContextFactory dataContextFactory;
    private final MetadataCleanupConfig config;
    private final Clock clock;

    public MetadataCleaner(DataContextFactory dataContextFactory, MetadataCleanupConfig config, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public int pump() {
        Instant cutoff = clock.instant().minusMillis(config.retentionMs());
        try (DataContext context = dataContextFactory.create();
             DataContextTransaction transaction = context.beginTransaction()) {
            List<Metadata> expired = context.metadata().findAll(
                metadata -> metadata.getWorkflowState().isTerminal()
                    && metadata.getEndTime() != null
                    && metadata.getEndTime().isBefore(cutoff)
                    && config.includes(metadata.getName()),
                Comparator.comparing(Metadata::getEndTime),
                config.batchSize());
            if (expired.isEmpty()) {
                return 0;
            }
            Set<Long> ids = expired.stream().map(Metadata::getId).collect(Collectors.toSet());
            int logs = context.logs().removeAll(entry -> ids.contains(entry.getMetadataId()));
            ids.forEach(id -> context.metadata().remove(id));
            context.saveChanges();
            transaction.commit();
            log.info("Metadata cleanup completed: {} metadata and {} log rows deleted", ids.size(), logs);
            return ids.size();
        }
    }
}
