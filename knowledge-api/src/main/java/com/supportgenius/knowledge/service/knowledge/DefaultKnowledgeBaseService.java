package com.supportgenius.knowledge.service.knowledge;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.model.KnowledgeItemView;
import com.supportgenius.knowledge.persistence.entity.KnowledgeItemEntity;
import com.supportgenius.knowledge.persistence.repository.KnowledgeItemRepository;
import com.supportgenius.knowledge.service.ingestion.IngestDocumentCommand;
import com.supportgenius.knowledge.service.ingestion.KnowledgeItemUploadedEvent;
import com.supportgenius.knowledge.service.ingestion.TransientFileStore;
import com.supportgenius.knowledge.service.vector.NamespaceStats;
import com.supportgenius.knowledge.service.vector.VectorCleanupService;
import com.supportgenius.knowledge.service.vector.VectorStoreClient;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class DefaultKnowledgeBaseService implements KnowledgeBaseService {

    private static final Logger log = LoggerFactory.getLogger(DefaultKnowledgeBaseService.class);

    private final KnowledgeItemRepository repository;
    private final TransientFileStore fileStore;
    private final VectorCleanupService vectorCleanupService;
    private final VectorStoreClient vectorStoreClient;
    private final ApplicationEventPublisher eventPublisher;
    private final long maxFileSizeBytes;
    private final Set<String> allowedTypes;

    public DefaultKnowledgeBaseService(KnowledgeItemRepository repository,
                                       TransientFileStore fileStore,
                                       VectorCleanupService vectorCleanupService,
                                       VectorStoreClient vectorStoreClient,
                                       ApplicationEventPublisher eventPublisher,
                                       @Value("${knowledge.uploads.max-file-size-bytes:10485760}") long maxFileSizeBytes,
                                       @Value("${knowledge.uploads.allowed-types:application/pdf,text/plain,text/markdown}") List<String> allowedTypes) {
        this.repository = repository;
        this.fileStore = fileStore;
        this.vectorCleanupService = vectorCleanupService;
        this.vectorStoreClient = vectorStoreClient;
        this.eventPublisher = eventPublisher;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.allowedTypes = allowedTypes.stream()
                .map(type -> type.trim().toLowerCase(Locale.ROOT))
                .filter(type -> !type.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    @Transactional
    public KnowledgeItemView upload(UploadKnowledgeCommand command) {
        if (command.agentId() == null || command.agentId().isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "Agent ID is required");
        }
        if (command.bytes() == null || command.bytes().length == 0) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "No file provided");
        }
        String contentType = command.contentType() == null ? "" : command.contentType().trim().toLowerCase(Locale.ROOT);
        if (!allowedTypes.contains(contentType)) {
            throw new KnowledgeException(KnowledgeErrorCode.UNSUPPORTED_TYPE, "Only PDF, TXT, and MD files are supported");
        }
        if (command.bytes().length > maxFileSizeBytes) {
            throw KnowledgeException.fileTooLarge(maxFileSizeBytes);
        }

        String originalName = command.originalName() == null || command.originalName().isBlank()
                ? "document"
                : FilenameUtils.getName(command.originalName());
        String extension = FilenameUtils.getExtension(originalName);
        String storedName = UUID.randomUUID() + (extension.isEmpty() ? "" : "." + extension);
        Path storedPath = fileStore.write(storedName, command.bytes());
        discardOnRollback(storedPath);
        try {
            KnowledgeItemEntity entity = repository.save(new KnowledgeItemEntity(
                    UUID.randomUUID().toString(),
                    command.agentId(),
                    storedName,
                    originalName,
                    contentType,
                    command.bytes().length));
            log.info("Accepted upload {} ({} bytes) for agent {} as knowledge item {}",
                    originalName, command.bytes().length, command.agentId(), entity.getId());

            eventPublisher.publishEvent(new KnowledgeItemUploadedEvent(new IngestDocumentCommand(
                    entity.getId(), storedPath, contentType, entity.getAgentId(), originalName)));
            return KnowledgeItemView.from(entity);
        } catch (RuntimeException ex) {
            discard(storedPath);
            throw ex;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<KnowledgeItemView> list(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "Agent ID is required");
        }
        return repository.findByAgentIdOrderByUploadedAtDesc(agentId).stream()
                .map(KnowledgeItemView::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public KnowledgeItemView get(String knowledgeItemId) {
        return KnowledgeItemView.from(require(knowledgeItemId));
    }

    /**
     * Vector cleanup runs outside any transaction; only the relational delete is transactional.
     */
    @Override
    public void delete(String knowledgeItemId) {
        KnowledgeItemEntity entity = require(knowledgeItemId);
        try {
            vectorCleanupService.deleteKnowledgeItemVectors(entity.getId(), entity.getAgentId());
        } catch (RuntimeException ex) {
            log.warn("Failed to delete vectors of knowledge item {} for agent {}, removing record anyway",
                    entity.getId(), entity.getAgentId(), ex);
        }
        repository.delete(entity);
        log.info("Deleted knowledge item {} for agent {}", entity.getId(), entity.getAgentId());
    }

    @Override
    public long deleteAgentKnowledge(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "Agent ID is required");
        }
        try {
            vectorStoreClient.deleteNamespace(agentId);
        } catch (RuntimeException ex) {
            log.warn("Failed to delete vector namespace for agent {}, removing records anyway", agentId, ex);
        }
        long removed = repository.deleteByAgentId(agentId);
        log.info("Deleted {} knowledge items for agent {}", removed, agentId);
        return removed;
    }

    @Override
    public NamespaceStats stats(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "Agent ID is required");
        }
        return vectorStoreClient.namespaceStats(agentId);
    }

    // a rolled-back upload leaves no item, so nothing else would remove the file
    private void discardOnRollback(Path storedPath) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    discard(storedPath);
                }
            }
        });
    }

    private void discard(Path storedPath) {
        try {
            fileStore.delete(storedPath);
        } catch (RuntimeException ex) {
            log.warn("Failed to clean up stored upload {}", storedPath, ex);
        }
    }

    private KnowledgeItemEntity require(String knowledgeItemId) {
        return repository.findById(knowledgeItemId)
                .orElseThrow(() -> new KnowledgeException(KnowledgeErrorCode.NOT_FOUND, "Knowledge base item not found"));
    }
}
