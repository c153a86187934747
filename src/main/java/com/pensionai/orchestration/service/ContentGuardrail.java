package com.pensionai.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Screens the final narrative for topics the advisor must not discuss.
 */
@Component
@Slf4j
public class ContentGuardrail {

    public enum Category {
        RELIGION(
                "\\b(religion|religious|church|mosque|temple|synagogue|god|allah|bible|quran|torah|pray|prayer)\\b"),
        POLITICS(
                "\\b(politics|political|politician|election|elections|democrat|democrats|republican|republicans"
                        + "|vote for|ballot|parliament|senator)\\b"),
        INVESTMENT_ADVICE(
                "\\b(buy|sell|short|purchase)\\s+(some\\s+|more\\s+)?(shares?|stocks?|bonds?|options|etfs?|crypto"
                        + "|cryptocurrency|cryptocurrencies|bitcoin|ethereum|nfts?)\\b"
                        + "|\\byou should (buy|sell)\\b"
                        + "|\\b(bitcoin|btc|ethereum|dogecoin)\\b"
                        // generic asset classes only count when recommended, not when reported
                        + "|\\b(invest|investing|buying|consider|allocate|allocating|move|put)\\b[\\w\\s,]{0,30}?"
                        + "\\b(crypto|cryptocurrency|cryptocurrencies|nfts?)\\b");

        private final Pattern pattern;

        Category(String regex) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }

        boolean matches(String text) {
            return pattern.matcher(text).find();
        }
    }

    public record Verdict(boolean allowed, List<Category> blockedCategories) {
        public Verdict {
            blockedCategories = List.copyOf(blockedCategories);
        }
    }

    public Verdict review(@Nullable String narrative) {
        if (narrative == null || narrative.isBlank()) {
            return new Verdict(true, List.of());
        }
        List<Category> matched = new ArrayList<>();
        for (Category category : Category.values()) {
            if (category.matches(narrative)) {
                matched.add(category);
            }
        }
        if (!matched.isEmpty()) {
            log.warn("Narrative blocked by guardrail: categories={}", matched);
        }
        return new Verdict(matched.isEmpty(), matched);
    }
}
