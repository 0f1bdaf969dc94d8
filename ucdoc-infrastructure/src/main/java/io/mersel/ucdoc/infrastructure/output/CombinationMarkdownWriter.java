package io.mersel.ucdoc.infrastructure.output;

import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.PictCombination;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Kombinasyonu Markdown tablo olarak yazar: faktör başına bir sütun, kural başına bir satır.
 */
@Component
public class CombinationMarkdownWriter {

    public String render(UseCase useCase, Variation variation) {
        PictCombination combination = variation.combination();
        List<Factor> factors = combination.getFactors();

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(useCase.id()).append(' ').append(MarkdownTable.escape(useCase.name())).append("\n\n");
        sb.append("## ").append(variation.id()).append(' ').append(MarkdownTable.escape(variation.description())).append("\n\n");

        List<String> header = new ArrayList<>();
        header.add("No");
        factors.forEach(f -> header.add(f.name()));
        sb.append(MarkdownTable.row(header));
        sb.append(MarkdownTable.separator(header.size()));

        for (int i = 0; i < combination.getRuleCount(); i++) {
            List<String> cells = new ArrayList<>();
            cells.add(String.valueOf(i + 1));
            for (Factor factor : factors) {
                cells.add(combination.getLevels(factor.id()).get(i).text());
            }
            sb.append(MarkdownTable.row(cells));
        }
        return sb.toString();
    }
}
