package com.kmg.dms.service;

import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.MatchingRule;
import com.kmg.dms.repo.MatchingRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates the active matching rules of a tenant (plus the global ones) in priority order and applies the
 * first match.
 */
@Service
public class RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final MatchingRuleRepository ruleRepository;
    private final Clock clock;

    public RuleEngine(MatchingRuleRepository ruleRepository, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.clock = clock;
    }

    /**
     * Batch path: matches against {@code "<original filename> <title>"}. Assignments only fill fields that are
     * still unset; the status only changes while the document is UNASSIGNED. Tags are merged.
     */
    public RuleApplication apply(DocumentRecord document) {
        String text = document.originalFilename() + " " + document.title();
        Optional<MatchingRule> match = firstMatch(document.tenantId(), text);
        if (match.isEmpty()) {
            return new RuleApplication(document, null);
        }

        MatchingRule rule = match.get();
        DocumentRecord updated = assign(document, rule);
        log.debug("Rule '{}' matched {}", rule.name(), document.originalFilename());
        return new RuleApplication(updated, rule);
    }

    /**
     * Applies the assignments of {@code rule} to the fields of {@code document} that are still open.
     */
    public static DocumentRecord assign(DocumentRecord document, MatchingRule rule) {
        DocumentRecord updated = document;
        if (rule.assignDocumentTypeId() != null && updated.documentTypeId() == null) {
            updated = updated.withDocumentTypeId(rule.assignDocumentTypeId());
        }
        if (rule.assignEmployeeId() != null && updated.employeeId() == null) {
            updated = updated.withEmployeeId(rule.assignEmployeeId());
        }
        if (rule.assignStatus() != null && updated.status() == DocumentStatus.UNASSIGNED) {
            updated = updated.withStatus(rule.assignStatus());
        }
        if (!rule.assignTags().isEmpty()) {
            Set<String> tags = new LinkedHashSet<>(updated.tags());
            tags.addAll(rule.assignTags());
            updated = updated.withTags(new ArrayList<>(tags));
        }
        return updated.withMetadata(updated.metadata().copy().put(DocumentMetadata.Key.MATCHED_RULE, rule.name()));
    }

    /**
     * Inline path: matches the filename alone and returns the rule whose assignments apply.
     */
    public Optional<MatchingRule> classifyFilename(String tenantId, String filename) {
        return firstMatch(tenantId, filename == null ? "" : filename);
    }

    private Optional<MatchingRule> firstMatch(String tenantId, String text) {
        for (MatchingRule rule : ruleRepository.findActiveGlobalOrTenant(tenantId)) {
            if (matches(rule, text)) {
                ruleRepository.recordMatch(rule.id(), OffsetDateTime.now(clock));
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    static boolean matches(MatchingRule rule, String text) {
        String pattern = rule.pattern();
        if (pattern == null || pattern.isBlank() || text == null) {
            return false;
        }
        String subject = rule.caseSensitive() ? text : text.toLowerCase(Locale.ROOT);
        String needle = rule.caseSensitive() ? pattern : pattern.toLowerCase(Locale.ROOT);

        return switch (rule.algorithm()) {
            case NONE -> false;
            case EXACT -> subject.contains(needle);
            case ANY -> words(needle).stream().anyMatch(subject::contains);
            case ALL -> words(needle).stream().allMatch(subject::contains);
            case REGEX -> regexMatches(pattern, text, rule.caseSensitive());
            case FUZZY -> fuzzyMatches(words(needle), subject);
        };
    }

    private static boolean regexMatches(String pattern, String text, boolean caseSensitive) {
        try {
            int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            return Pattern.compile(pattern, flags).matcher(text).find();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid rule pattern '{}': {}", pattern, e.getDescription());
            return false;
        }
    }

    /**
     * Positional similarity: a word of at least four characters matches when some window of the text of the
     * same length agrees with it in at least 80% of positions.
     */
    private static boolean fuzzyMatches(List<String> words, String text) {
        for (String word : words) {
            int length = word.length();
            if (length < 4) {
                continue;
            }
            for (int offset = 0; offset + length <= text.length(); offset++) {
                int same = 0;
                for (int i = 0; i < length; i++) {
                    if (word.charAt(i) == text.charAt(offset + i)) {
                        same++;
                    }
                }
                if (same * 5 >= length * 4) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> words(String pattern) {
        String trimmed = pattern.strip();
        return trimmed.isEmpty() ? List.of() : List.of(WHITESPACE.split(trimmed));
    }

    public record RuleApplication(DocumentRecord document, MatchingRule rule) {
        public boolean matched() {
            return rule != null;
        }
    }
}
