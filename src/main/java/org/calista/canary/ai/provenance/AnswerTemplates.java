package org.calista.canary.ai.provenance;

import java.util.Locale;

/**
 * User-facing wording for grounded answers. Section order is fixed by {@link GroundedAnswer};
 * only the words change between renditions.
 */
public final class AnswerTemplates {

    // ---- headers ----
    public final String headerFull;
    public final String headerPartial;
    public final String headerRequestMore;
    public final String headerRefuse;

    // ---- content transforms ----
    public final String partialDisclaimer;
    public final String limitedPreamble;
    public final String limitedPostamble;
    public final String refusal;

    // ---- sections ----
    public final String sectionConfidence;
    public final String bucketHigh;
    public final String bucketMedium;
    public final String bucketLow;
    public final String sectionLimitations;
    public final String sectionSuggestions;

    // ---- limitations (use %s / %d) ----
    public final String limitNearExpiry;
    public final String limitExpired;
    public final String limitSingleSource;

    // ---- suggestions ----
    public final String suggestSearch;
    public final String suggestUserContext;
    public final String suggestSpecifics;
    public final String suggestDecompose;
    public final String suggestMoreData;

    // ---- provenance summary ----
    public final String summaryTitle;
    public final String summaryValid;
    public final String summaryNone;
    public final String summaryExpired;

    private AnswerTemplates(String[] t) {
        int i = 0;
        headerFull = t[i++];
        headerPartial = t[i++];
        headerRequestMore = t[i++];
        headerRefuse = t[i++];
        partialDisclaimer = t[i++];
        limitedPreamble = t[i++];
        limitedPostamble = t[i++];
        refusal = t[i++];
        sectionConfidence = t[i++];
        bucketHigh = t[i++];
        bucketMedium = t[i++];
        bucketLow = t[i++];
        sectionLimitations = t[i++];
        sectionSuggestions = t[i++];
        limitNearExpiry = t[i++];
        limitExpired = t[i++];
        limitSingleSource = t[i++];
        suggestSearch = t[i++];
        suggestUserContext = t[i++];
        suggestSpecifics = t[i++];
        suggestDecompose = t[i++];
        suggestMoreData = t[i++];
        summaryTitle = t[i++];
        summaryValid = t[i++];
        summaryNone = t[i++];
        summaryExpired = t[i];
    }

    private static final AnswerTemplates ENGLISH = new AnswerTemplates(new String[]{
            "[Full answer]\n",
            "[Partial answer]\nSome of this information is uncertain.\n",
            "[Insufficient information]\nMore information is needed for a complete answer.\n",
            "[Cannot answer]\nThere is not enough observed data.\n",
            "\n\nNote: parts of the above are based on limited observations and may be uncertain.",
            "Based on the available observations I can only offer the following limited information:\n\n",
            "\n\nMore information is needed for a complete answer.",
            "Sorry, I do not have enough observed data to answer this question.\n\n"
                    + "To avoid giving inaccurate information, I will not guess.",
            "\n\n[Confidence assessment]",
            "\nHigh confidence:",
            "\nMedium confidence:",
            "\nLow confidence:",
            "\n\n[Limitations]",
            "\n\n[Suggestions]",
            "Some data (from %s) is about to expire; consider fetching it again",
            "%d observation(s) have expired",
            "Information comes from a single source; consider cross-validating",
            "Try the web_search tool to find more relevant information",
            "Or provide more specific background information",
            "Please provide more specific information about the question",
            "Try breaking the question into smaller, searchable parts",
            "Gathering more relevant data would make the answer more reliable",
            "[Observation summary]",
            "Valid observations: %d",
            "No valid observations",
            "Expired: %d"
    });

    private static final AnswerTemplates CHINESE = new AnswerTemplates(new String[]{
            "【完整回答】\n",
            "【部分回答】\n⚠️ 部分信息存在不确定性\n",
            "【信息不足】\n❓ 需要更多信息才能完整回答\n",
            "【无法回答】\n❌ 当前没有足够的观测数据\n",
            "\n\n⚠️ 注意：以上部分内容基于有限的观测数据，可能存在不确定性。",
            "基于现有观测数据，我只能提供以下有限信息：\n\n",
            "\n\n❓ 需要更多信息才能给出完整回答。",
            "抱歉，我目前没有足够的观测数据来回答这个问题。\n\n为避免提供不准确的信息，我选择不进行猜测。",
            "\n\n【置信度评估】",
            "\n✅ 高置信度：",
            "\n⚠️ 中置信度：",
            "\n❓ 低置信度：",
            "\n\n【信息局限性】",
            "\n\n【建议】",
            "部分数据（来自%s）即将过期，建议重新获取",
            "有 %d 条观测数据已过期",
            "信息仅来自单一来源，建议交叉验证",
            "可以尝试使用 web_search 工具搜索更多相关信息",
            "或者您可以提供更多具体的背景信息",
            "请提供更多关于问题的具体信息",
            "可以尝试将问题分解为更小的、可搜索的部分",
            "获取更多相关数据可以提高答案的可信度",
            "【观测数据摘要】",
            "有效观测: %d 条",
            "无有效观测数据",
            "已过期: %d 条"
    });

    public static AnswerTemplates english() {
        return ENGLISH;
    }

    public static AnswerTemplates chinese() {
        return CHINESE;
    }

    /** "zh*" selects Chinese; anything else English. */
    public static AnswerTemplates forLocale(String locale) {
        if (locale != null && locale.trim().toLowerCase(Locale.ROOT).startsWith("zh")) return CHINESE;
        return ENGLISH;
    }

    public String header(DegradationLevel level) {
        switch (level) {
            case FULL_ANSWER:
                return headerFull;
            case PARTIAL_WITH_UNCERTAINTY:
                return headerPartial;
            case REQUEST_MORE_INFO:
                return headerRequestMore;
            default:
                return headerRefuse;
        }
    }
}
