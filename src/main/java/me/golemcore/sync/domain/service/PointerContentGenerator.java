package me.golemcore.sync.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.sync.domain.model.ConstraintSeverity;
import me.golemcore.sync.domain.model.KnowledgeConstraint;
import me.golemcore.sync.domain.model.KnowledgeItem;

import java.util.List;

/**
 * Renders the text of a pointer memory.
 *
 * <p>
 * Layout:
 *
 * <pre>
 * [adr] Use PostgreSQL (deprecated)
 * Relational data goes to PostgreSQL.
 * - must_use: postgres [db]
 * - No MongoDB for transactional data
 * Source: knowledge://adr-001
 * </pre>
 *
 * The status suffix appears only for retired items. At most
 * {@code maxBlockingConstraints} BLOCK-severity constraints are listed. When
 * the text exceeds {@code maxLength} the body is shortened and the source line
 * is always kept. The source line is therefore the floor: when it alone is
 * longer than {@code maxLength}, the result is just that line.
 */
public final class PointerContentGenerator {

    public static final int DEFAULT_MAX_LENGTH = 800;
    public static final int DEFAULT_MAX_BLOCKING_CONSTRAINTS = 3;

    private static final String ELLIPSIS = "...";

    private PointerContentGenerator() {
    }

    public static String generate(KnowledgeItem item) {
        return generate(item, DEFAULT_MAX_LENGTH, DEFAULT_MAX_BLOCKING_CONSTRAINTS);
    }

    public static String generate(KnowledgeItem item, int maxLength, int maxBlockingConstraints) {
        StringBuilder body = new StringBuilder();
        body.append(titleLine(item));

        String summary = item.getSummary();
        if (summary != null && !summary.isBlank()) {
            body.append('\n').append(summary.strip());
        }

        List<KnowledgeConstraint> constraints = item.getConstraints() != null ? item.getConstraints() : List.of();
        int rendered = 0;
        for (KnowledgeConstraint constraint : constraints) {
            if (rendered >= maxBlockingConstraints) {
                break;
            }
            if (constraint.getSeverity() == ConstraintSeverity.BLOCK) {
                body.append("\n- ").append(renderConstraint(constraint));
                rendered++;
            }
        }

        String reference = "Source: knowledge://" + item.getId();
        int bodyBudget = maxLength - reference.length() - 1;
        String text = body.toString();
        if (text.length() > bodyBudget) {
            text = bodyBudget > ELLIPSIS.length()
                    ? cut(text, bodyBudget - ELLIPSIS.length()) + ELLIPSIS
                    : "";
        }
        return text.isEmpty() ? reference : text + '\n' + reference;
    }

    /**
     * Longest prefix of at most {@code maxChars} chars that does not split a
     * surrogate pair.
     */
    static String cut(String text, int maxChars) {
        int end = maxChars;
        if (end > 0 && end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))
                && Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static String titleLine(KnowledgeItem item) {
        StringBuilder line = new StringBuilder();
        if (item.getType() != null) {
            line.append('[').append(item.getType().getCode()).append("] ");
        }
        String title = item.getTitle();
        line.append(title != null && !title.isBlank() ? title.strip() : item.getId());
        if (item.getStatus() != null && item.getStatus().isRetired()) {
            line.append(" (").append(item.getStatus().getCode()).append(')');
        }
        return line.toString();
    }

    private static String renderConstraint(KnowledgeConstraint constraint) {
        String message = constraint.getMessage();
        if (message != null && !message.isBlank()) {
            return message.strip();
        }
        StringBuilder line = new StringBuilder();
        line.append(constraint.getOperator() != null ? constraint.getOperator().getCode() : "constraint")
                .append(": ")
                .append(constraint.getPattern() != null ? constraint.getPattern() : "");
        if (constraint.getTarget() != null && !constraint.getTarget().isBlank()) {
            line.append(" [").append(constraint.getTarget()).append(']');
        }
        return line.toString();
    }
}
