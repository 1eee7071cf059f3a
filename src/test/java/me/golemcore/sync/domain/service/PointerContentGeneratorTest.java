package me.golemcore.sync.domain.service;

import me.golemcore.sync.domain.model.ConstraintOperator;
import me.golemcore.sync.domain.model.ConstraintSeverity;
import me.golemcore.sync.domain.model.KnowledgeConstraint;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeStatus;
import me.golemcore.sync.testsupport.InMemoryKnowledgeRepository;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PointerContentGeneratorTest {

    @Test
    void shouldRenderTitleSummaryAndSourceReference() {
        KnowledgeItem item = InMemoryKnowledgeRepository.item("adr-001", "body");
        item.setTitle("Use PostgreSQL");
        item.setSummary("Relational data goes to PostgreSQL.");

        String content = PointerContentGenerator.generate(item);

        assertEquals("[adr] Use PostgreSQL\nRelational data goes to PostgreSQL.\nSource: knowledge://adr-001",
                content);
    }

    @Test
    void shouldMarkRetiredItemsOnly() {
        KnowledgeItem deprecated = InMemoryKnowledgeRepository.item("adr-001", "body");
        deprecated.setStatus(KnowledgeStatus.DEPRECATED);
        KnowledgeItem draft = InMemoryKnowledgeRepository.item("adr-002", "body");
        draft.setStatus(KnowledgeStatus.DRAFT);

        assertTrue(PointerContentGenerator.generate(deprecated).startsWith("[adr] Title adr-001 (deprecated)\n"));
        assertTrue(PointerContentGenerator.generate(draft).startsWith("[adr] Title adr-002\n"));
    }

    @Test
    void shouldListOnlyLimitedBlockingConstraints() {
        KnowledgeItem item = InMemoryKnowledgeRepository.item("adr-001", "body");
        List<KnowledgeConstraint> constraints = new ArrayList<>();
        constraints.add(constraint("warn-only", ConstraintSeverity.WARN, null));
        constraints.add(constraint("postgres", ConstraintSeverity.BLOCK, null));
        constraints.add(constraint("mongo", ConstraintSeverity.BLOCK, "No MongoDB for transactional data"));
        constraints.add(constraint("redis", ConstraintSeverity.BLOCK, null));
        constraints.add(constraint("kafka", ConstraintSeverity.BLOCK, null));
        item.setConstraints(constraints);

        String content = PointerContentGenerator.generate(item);

        assertTrue(content.contains("\n- must_use: postgres [db]\n"));
        assertTrue(content.contains("\n- No MongoDB for transactional data\n"));
        assertTrue(content.contains("\n- must_use: redis [db]\n"));
        assertFalse(content.contains("kafka"));
        assertFalse(content.contains("warn-only"));
    }

    @Test
    void shouldKeepSourceReferenceWhenTruncating() {
        KnowledgeItem item = InMemoryKnowledgeRepository.item("adr-001", "body");
        item.setSummary("x".repeat(5000));

        String content = PointerContentGenerator.generate(item, 120, 3);

        assertTrue(content.length() <= 120);
        assertTrue(content.endsWith("...\nSource: knowledge://adr-001"));
        assertTrue(content.startsWith("[adr] Title adr-001\n"));
    }

    @Test
    void shouldFallBackToReferenceWhenLimitIsTiny() {
        KnowledgeItem item = InMemoryKnowledgeRepository.item("adr-001", "body");

        assertEquals("Source: knowledge://adr-001", PointerContentGenerator.generate(item, 10, 3));
    }

    @Test
    void shouldNotSplitSurrogatePairWhenTruncating() {
        KnowledgeItem item = InMemoryKnowledgeRepository.item("x", "body");
        item.setTitle("abcdefgh😀 and more");

        String content = PointerContentGenerator.generate(item, 40, 3);

        assertEquals("[adr] abcdefgh...\nSource: knowledge://x", content);
        assertTrue(content.length() <= 40);
    }

    @Test
    void shouldBeDeterministic() {
        KnowledgeItem item = InMemoryKnowledgeRepository.item("adr-001", "body");
        item.setConstraints(List.of(constraint("postgres", ConstraintSeverity.BLOCK, null)));

        assertEquals(PointerContentGenerator.generate(item), PointerContentGenerator.generate(item));
    }

    private static KnowledgeConstraint constraint(String pattern, ConstraintSeverity severity, String message) {
        return KnowledgeConstraint.builder()
                .operator(ConstraintOperator.MUST_USE)
                .pattern(pattern)
                .target("db")
                .severity(severity)
                .message(message)
                .build();
    }
}
