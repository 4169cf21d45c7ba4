package com.fvgscanner.structure;

import com.fvgscanner.domain.enums.CandidateStatus;
import com.fvgscanner.domain.model.FvgCandidate;
import com.fvgscanner.domain.model.StructureBreak;
import com.fvgscanner.domain.model.SwingPivot;
import java.util.List;

/**
 * Everything the structure detector derived from one symbol's series. Candidates are
 * ordered by formation index.
 */
public record StructureAnalysis(
        List<SwingPivot> pivots, List<StructureBreak> structureBreaks, List<FvgCandidate> candidates) {

    public List<FvgCandidate> qualified() {
        return withStatus(CandidateStatus.QUALIFIED);
    }

    public List<FvgCandidate> withStatus(CandidateStatus status) {
        return candidates.stream().filter(c -> c.getStatus() == status).toList();
    }

    public long count(CandidateStatus status) {
        return candidates.stream().filter(c -> c.getStatus() == status).count();
    }
}
