package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.escalation.EscalationDecision;
import com.ryuqq.registry.application.escalation.EscalationPolicy;
import com.ryuqq.registry.core.model.TrackedItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword-based escalation.
 *
 * <p>An item matches when its text contains one of the keywords, compared in lower
 * case. Items without text never match.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class KeywordEscalationPolicy implements EscalationPolicy {

    /**
     * Docket movements that usually come with a new document.
     */
    public static final List<String> DEFAULT_KEYWORDS = List.of(
        // filings
        "juntada", "juntado", "juntou", "anexado", "anexou", "protocolado", "protocolo",
        "petição", "petição inicial", "contestação", "réplica", "manifestação", "impugnação",
        // appeals
        "recurso", "apelação", "agravo", "embargos",
        // rulings
        "sentença", "decisão", "despacho", "acórdão", "decisão interlocutória", "decisão monocrática", "voto",
        // expert and registry documents
        "laudo", "perícia", "parecer", "relatório", "certidão", "atestado", "documento", "comprovante",
        "nota fiscal", "contrato", "procuração",
        // communications
        "intimação", "citação", "notificação", "edital",
        // hearings
        "ata de audiência", "termo de audiência", "ata de sessão", "gravação",
        // orders
        "alvará", "mandado", "ofício", "carta precatória", "carta rogatória"
    );

    private final List<String> keywords;

    public KeywordEscalationPolicy() {
        this(DEFAULT_KEYWORDS);
    }

    public KeywordEscalationPolicy(Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("keywords cannot be null or empty");
        }
        List<String> normalized = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                throw new IllegalArgumentException("keyword cannot be null or blank");
            }
            normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
        }
        this.keywords = List.copyOf(normalized);
    }

    @Override
    public EscalationDecision evaluate(List<TrackedItem> items) {
        if (items == null || items.isEmpty()) {
            return EscalationDecision.notRequired();
        }
        Set<String> matched = new LinkedHashSet<>();
        int matchedItems = 0;
        for (TrackedItem item : items) {
            if (!item.hasText()) {
                continue;
            }
            String text = item.text().toLowerCase(Locale.ROOT);
            boolean itemMatched = false;
            for (String keyword : keywords) {
                if (text.contains(keyword)) {
                    matched.add(keyword);
                    itemMatched = true;
                }
            }
            if (itemMatched) {
                matchedItems++;
            }
        }
        return matched.isEmpty()
            ? EscalationDecision.notRequired()
            : EscalationDecision.required(new ArrayList<>(matched), matchedItems);
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
