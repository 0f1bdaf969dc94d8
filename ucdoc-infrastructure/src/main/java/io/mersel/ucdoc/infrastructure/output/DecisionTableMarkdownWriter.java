package io.mersel.ucdoc.infrastructure.output;

import io.mersel.ucdoc.application.enums.ConditionMark;
import io.mersel.ucdoc.application.enums.ResultMark;
import io.mersel.ucdoc.application.models.BranchDecisionTable;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.DecisionTable.ConditionRow;
import io.mersel.ucdoc.application.models.DecisionTable.ResultRow;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VerificationPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Karar tablosunu Markdown olarak yazar.
 * <p>
 * Sütunlar: tür, giriş noktası / doğrulama noktası, faktör / sonuç, seviye / açıklama, {@code 1..r}.
 * Ardından varsa dal alt tabloları gelir.
 */
@Component
public class DecisionTableMarkdownWriter {

    public String render(UseCase useCase, Variation variation, DecisionTable table, List<BranchDecisionTable> branchTables) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(useCase.id()).append(' ').append(MarkdownTable.escape(useCase.name())).append("\n\n");
        sb.append("## ").append(variation.id()).append(' ').append(MarkdownTable.escape(variation.description())).append("\n\n");
        appendTable(sb, table);

        for (BranchDecisionTable branchTable : branchTables) {
            sb.append("\n### ").append(branchTable.branch().id()).append(' ')
                    .append(MarkdownTable.escape(branchTable.branch().description())).append("\n\n");
            appendTable(sb, branchTable.table());
        }
        return sb.toString();
    }

    private void appendTable(StringBuilder sb, DecisionTable table) {
        List<String> header = new ArrayList<>(List.of("", "", "", ""));
        for (int ruleNo = 1; ruleNo <= table.ruleCount(); ruleNo++) {
            header.add(String.valueOf(ruleNo));
        }
        sb.append(MarkdownTable.row(header));
        sb.append(MarkdownTable.separator(header.size()));

        for (ConditionRow row : table.conditionRows()) {
            List<String> cells = new ArrayList<>();
            cells.add("Koşul");
            cells.add(row.entryPointId());
            cells.add(row.factor().name());
            cells.add(row.level().text());
            row.marks().stream().map(ConditionMark::getSymbol).forEach(cells::add);
            sb.append(MarkdownTable.row(cells));
        }
        for (ResultRow row : table.resultRows()) {
            List<String> cells = new ArrayList<>();
            cells.add("Sonuç");
            cells.add(row.result().verificationPoints().stream()
                    .map(VerificationPoint::id)
                    .collect(Collectors.joining(", ")));
            cells.add(row.result().id());
            cells.add(row.result().description());
            row.marks().stream().map(ResultMark::getSymbol).forEach(cells::add);
            sb.append(MarkdownTable.row(cells));
        }
    }
}
