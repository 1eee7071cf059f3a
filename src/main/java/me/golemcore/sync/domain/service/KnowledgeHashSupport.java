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

import me.golemcore.sync.domain.model.KnowledgeConstraint;
import me.golemcore.sync.domain.model.KnowledgeItem;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Content hashing of knowledge items.
 *
 * <p>
 * The hash covers content, constraints and status, in that order, over a
 * canonical text form; anything else about an item (title, summary, layer) is
 * metadata and does not affect it.
 */
public final class KnowledgeHashSupport {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private KnowledgeHashSupport() {
    }

    public static String computeHash(KnowledgeItem item) {
        StringBuilder canonical = new StringBuilder();
        canonical.append("content:").append(nullToEmpty(item.getContent())).append('\n');
        List<KnowledgeConstraint> constraints = item.getConstraints() != null ? item.getConstraints() : List.of();
        for (KnowledgeConstraint constraint : constraints) {
            canonical.append("constraint:")
                    .append(constraint.getOperator() != null ? constraint.getOperator().getCode() : "").append('|')
                    .append(escape(constraint.getPattern())).append('|')
                    .append(escape(constraint.getTarget())).append('|')
                    .append(constraint.getSeverity() != null ? constraint.getSeverity().getCode() : "").append('|')
                    .append(escape(constraint.getMessage())).append('\n');
        }
        canonical.append("status:").append(item.getStatus() != null ? item.getStatus().getCode() : "");
        return sha256Hex(canonical.toString());
    }

    /**
     * The repository-published hash when present, otherwise a locally computed
     * one.
     */
    public static String resolveHash(KnowledgeItem item) {
        String published = item.getContentHash();
        if (published != null && !published.isBlank()) {
            return published;
        }
        return computeHash(item);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                int v = b & 0xFF;
                builder.append(HEX[v >>> 4]).append(HEX[v & 0x0F]);
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String escape(String value) {
        return nullToEmpty(value).replace("\\", "\\\\").replace("|", "\\|").replace("\n", "\\n");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
