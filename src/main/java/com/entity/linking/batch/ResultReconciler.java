package com.entity.linking.batch;

import com.entity.linking.core.model.BatchRow;
import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.core.model.ScoredCandidate;
import com.entity.linking.scoring.CandidateScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins the three batch stage outputs into one {@link BatchRow} per (mention, context) pair.
 *
 * <p>Context rows drive the join; canonical rows are joined by mention and lookup rows by
 * canonical name. Candidates are ranked with each row's own context signal, so two rows that
 * share a canonical name can still link to different entities. A join miss leaves the
 * corresponding fields null.</p>
 */
public class ResultReconciler {
    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    private final CandidateScorer scorer;

    public ResultReconciler() {
        this(new CandidateScorer());
    }

    public ResultReconciler(CandidateScorer scorer) {
        this.scorer = scorer != null ? scorer : new CandidateScorer();
    }

    public ReconciliationResult reconcile(List<ContextAnalysisRow> contextRows,
                                          List<CanonicalNameRow> canonicalRows,
                                          List<CandidateLookupRow> lookupRows) {
        Map<String, String> canonicalByMention = new HashMap<>();
        for (CanonicalNameRow row : canonicalRows) {
            canonicalByMention.putIfAbsent(row.mention(), row.canonicalName());
        }
        Map<String, CandidateLookupRow> lookupByName = new HashMap<>();
        for (CandidateLookupRow row : lookupRows) {
            lookupByName.putIfAbsent(row.canonicalName(), row);
        }

        List<BatchRow> rows = new ArrayList<>(contextRows.size());
        for (ContextAnalysisRow contextRow : contextRows) {
            rows.add(reconcileRow(contextRow, canonicalByMention.get(contextRow.mention()), lookupByName));
        }

        ReconciliationResult result = new ReconciliationResult(rows);
        log.info("batch.reconciled rows={} errorOrAmbiguous={}", result.size(), result.errorCount());
        return result;
    }

    private BatchRow reconcileRow(ContextAnalysisRow contextRow, String canonicalName,
                                  Map<String, CandidateLookupRow> lookupByName) {
        ContextSignal signal = contextRow.contextSignal();

        String topUri = null;
        Double topScore = null;
        CandidateLookupRow lookup = canonicalName != null ? lookupByName.get(canonicalName) : null;
        if (lookup != null && !lookup.candidates().isEmpty()) {
            List<ScoredCandidate> ranked = scorer.rank(lookup.candidates(), signal, 1);
            topUri = ranked.get(0).identifier();
            topScore = ranked.get(0).score();
        }

        return new BatchRow(
                contextRow.mention(),
                contextRow.context(),
                canonicalName,
                signal != null ? signal.entityType() : null,
                signal != null ? signal.confidence() : null,
                signal != null ? signal.keywords() : List.of(),
                signal != null ? signal.description() : null,
                topUri,
                topScore);
    }
}
