package com.evidencelocker.core.infrastructure.jdbc;

import com.evidencelocker.core.domain.policy.CaseRelations;
import com.evidencelocker.core.domain.policy.CommentRelations;
import com.evidencelocker.core.domain.policy.CustodyEntryRelations;
import com.evidencelocker.core.domain.policy.EvidenceRelations;
import com.evidencelocker.core.domain.policy.TagRelations;
import com.evidencelocker.core.domain.ports.RelationSnapshotReader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Relation snapshots read with one SQL statement each. Evidence snapshots join the owning case and
 * every custody recipient, so the policy never sees a case, uploader and custodian set taken at
 * different moments.
 */
@Component
public class JdbcRelationSnapshotReader implements RelationSnapshotReader {

    private static final String CASE_SQL =
            "SELECT c.id, c.created_by, c.lead_investigator_id, c.assigned_to FROM cases c WHERE c.id = ?";

    private static final String EVIDENCE_SELECT =
            "SELECT e.id AS evidence_id, e.uploaded_by, c.id AS case_id, c.created_by, c.lead_investigator_id, " +
            "c.assigned_to, coc.to_principal_id AS custodian_id " +
            "FROM evidence e " +
            "JOIN cases c ON c.id = e.case_id " +
            "LEFT JOIN chain_of_custody coc ON coc.evidence_id = e.id AND coc.to_principal_id IS NOT NULL ";

    private static final String COMMENT_SQL =
            "SELECT cm.id AS comment_id, cm.author_id, cm.case_id AS parent_case_id, " +
            "e.id AS evidence_id, e.uploaded_by, c.id AS case_id, c.created_by, c.lead_investigator_id, " +
            "c.assigned_to, coc.to_principal_id AS custodian_id " +
            "FROM comments cm " +
            "LEFT JOIN evidence e ON e.id = cm.evidence_id " +
            "JOIN cases c ON c.id = COALESCE(cm.case_id, e.case_id) " +
            "LEFT JOIN chain_of_custody coc ON coc.evidence_id = e.id AND coc.to_principal_id IS NOT NULL " +
            "WHERE cm.id = ?";

    private static final String CUSTODY_ENTRY_SQL =
            "SELECT x.id AS entry_id, e.id AS evidence_id, e.uploaded_by, c.id AS case_id, c.created_by, " +
            "c.lead_investigator_id, c.assigned_to, coc.to_principal_id AS custodian_id " +
            "FROM chain_of_custody x " +
            "JOIN evidence e ON e.id = x.evidence_id " +
            "JOIN cases c ON c.id = e.case_id " +
            "LEFT JOIN chain_of_custody coc ON coc.evidence_id = e.id AND coc.to_principal_id IS NOT NULL " +
            "WHERE x.id = ?";

    private static final String TAG_SQL = "SELECT t.id, t.created_by FROM tags t WHERE t.id = ?";

    private final JdbcTemplate jdbc;

    public JdbcRelationSnapshotReader(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<CaseRelations> caseRelations(UUID caseId) {
        return jdbc.query(CASE_SQL, (rs, i) -> new CaseRelations(
                uuid(rs, "id"), uuid(rs, "created_by"), uuid(rs, "lead_investigator_id"), uuid(rs, "assigned_to")
        ), caseId).stream().findFirst();
    }

    @Override
    public Optional<EvidenceRelations> evidenceRelations(UUID evidenceId) {
        return groupEvidence(jdbc.query(EVIDENCE_SELECT + "WHERE e.id = ?", this::evidenceRow, evidenceId))
                .stream().findFirst();
    }

    @Override
    public List<EvidenceRelations> evidenceRelationsInCase(UUID caseId) {
        return groupEvidence(jdbc.query(EVIDENCE_SELECT + "WHERE e.case_id = ? ORDER BY e.created_at DESC",
                this::evidenceRow, caseId));
    }

    @Override
    public Optional<CommentRelations> commentRelations(UUID commentId) {
        List<CommentRow> rows = jdbc.query(COMMENT_SQL, (rs, i) -> new CommentRow(
                uuid(rs, "comment_id"), uuid(rs, "author_id"), uuid(rs, "parent_case_id"),
                uuid(rs, "evidence_id") == null ? null : evidenceRow(rs, i),
                caseRow(rs)
        ), commentId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        CommentRow first = rows.get(0);
        if (first.parentCaseId() != null) {
            return Optional.of(new CommentRelations(first.commentId(), first.authorId(), first.caseRelations(), null));
        }
        EvidenceRelations parent = groupEvidence(rows.stream().map(CommentRow::evidence).toList()).get(0);
        return Optional.of(new CommentRelations(first.commentId(), first.authorId(), null, parent));
    }

    @Override
    public Optional<CustodyEntryRelations> custodyEntryRelations(UUID entryId) {
        List<EvidenceRow> rows = jdbc.query(CUSTODY_ENTRY_SQL, this::evidenceRow, entryId);
        return groupEvidence(rows).stream().findFirst()
                .map(evidence -> new CustodyEntryRelations(entryId, evidence));
    }

    @Override
    public Optional<TagRelations> tagRelations(UUID tagId) {
        return jdbc.query(TAG_SQL, (rs, i) -> new TagRelations(uuid(rs, "id"), uuid(rs, "created_by")), tagId)
                .stream().findFirst();
    }

    private EvidenceRow evidenceRow(ResultSet rs, int rowNum) throws SQLException {
        return new EvidenceRow(uuid(rs, "evidence_id"), uuid(rs, "uploaded_by"), caseRow(rs), uuid(rs, "custodian_id"));
    }

    private static CaseRelations caseRow(ResultSet rs) throws SQLException {
        return new CaseRelations(uuid(rs, "case_id"), uuid(rs, "created_by"),
                uuid(rs, "lead_investigator_id"), uuid(rs, "assigned_to"));
    }

    /** Folds one row per custodian back into one snapshot per evidence item, keeping row order. */
    private static List<EvidenceRelations> groupEvidence(List<EvidenceRow> rows) {
        Map<UUID, EvidenceRow> firstRow = new LinkedHashMap<>();
        Map<UUID, Set<UUID>> custodians = new LinkedHashMap<>();
        for (EvidenceRow row : rows) {
            firstRow.putIfAbsent(row.evidenceId(), row);
            Set<UUID> ids = custodians.computeIfAbsent(row.evidenceId(), k -> new HashSet<>());
            if (row.custodianId() != null) {
                ids.add(row.custodianId());
            }
        }
        List<EvidenceRelations> result = new ArrayList<>(firstRow.size());
        firstRow.forEach((id, row) ->
                result.add(new EvidenceRelations(id, row.uploaderId(), row.caseRelations(), custodians.get(id))));
        return result;
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    private record EvidenceRow(UUID evidenceId, UUID uploaderId, CaseRelations caseRelations, UUID custodianId) {
    }

    private record CommentRow(UUID commentId, UUID authorId, UUID parentCaseId, EvidenceRow evidence,
                              CaseRelations caseRelations) {
    }
}
