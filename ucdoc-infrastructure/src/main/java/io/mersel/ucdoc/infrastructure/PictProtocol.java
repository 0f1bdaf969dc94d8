package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.interfaces.AdapterProtocolException;

import java.util.ArrayList;
import java.util.List;

/**
 * PICT metin protokolü.
 * <p>
 * İstek: faktör başına {@code f<N>: i0, i1, ...} satırı; seviyeler konumsal
 * {@code i<K>} belirteçleriyle kodlanır, böylece seviye metinlerindeki özel
 * karakterler üreticiye ulaşmaz. Kısıt metni boş bir satırdan sonra aynen eklenir.
 * <p>
 * Yanıt: sekmeyle ayrılmış başlık ({@code f0\tf1...}) ve kural başına bir satır.
 */
final class PictProtocol {

    private PictProtocol() {
    }

    /**
     * @param levelCounts Faktör başına etkin seviye sayısı, sütun sırasıyla
     * @param constraint  Kısıt metni (boş olabilir)
     */
    static String encodeRequest(List<Integer> levelCounts, String constraint) {
        StringBuilder sb = new StringBuilder();
        for (int f = 0; f < levelCounts.size(); f++) {
            sb.append('f').append(f).append(": ");
            for (int i = 0; i < levelCounts.get(f); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append('i').append(i);
            }
            sb.append('\n');
        }
        if (constraint != null && !constraint.isBlank()) {
            sb.append('\n').append(constraint);
            if (!constraint.endsWith("\n")) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Yanıtı çözümler.
     *
     * @param output      Üretici standart çıktısı
     * @param levelCounts Faktör başına etkin seviye sayısı
     * @return Kural başına, faktör sırasıyla seviye indeksleri
     * @throws AdapterProtocolException Başlık, sütun sayısı veya belirteç hatalıysa
     */
    static List<int[]> decodeResponse(String output, List<Integer> levelCounts) {
        int factorCount = levelCounts.size();
        List<String> lines = output.lines().filter(l -> !l.isBlank()).toList();
        if (lines.isEmpty()) {
            throw new AdapterProtocolException("PICT çıktısı boş");
        }

        String[] header = lines.get(0).split("\t", -1);
        if (header.length != factorCount) {
            throw new AdapterProtocolException("PICT başlık sütun sayısı hatalı: beklenen " + factorCount
                    + ", gelen " + header.length);
        }
        for (int f = 0; f < factorCount; f++) {
            if (!header[f].trim().equals("f" + f)) {
                throw new AdapterProtocolException("PICT başlığı hatalı: sütun " + f + " = '" + header[f] + "'");
            }
        }

        List<int[]> rows = new ArrayList<>();
        for (int r = 1; r < lines.size(); r++) {
            String[] tokens = lines.get(r).split("\t", -1);
            if (tokens.length != factorCount) {
                throw new AdapterProtocolException("PICT satır " + r + " sütun sayısı hatalı: beklenen "
                        + factorCount + ", gelen " + tokens.length);
            }
            int[] row = new int[factorCount];
            for (int f = 0; f < factorCount; f++) {
                row[f] = parseToken(tokens[f].trim(), levelCounts.get(f), r, f);
            }
            rows.add(row);
        }
        if (rows.isEmpty()) {
            throw new AdapterProtocolException("PICT hiç kural üretmedi");
        }
        return rows;
    }

    private static int parseToken(String token, int levelCount, int row, int column) {
        if (!token.startsWith("i") || token.length() < 2) {
            throw new AdapterProtocolException("PICT satır " + row + ", sütun " + column
                    + ": tanınmayan seviye belirteci '" + token + "'");
        }
        int index;
        try {
            index = Integer.parseInt(token.substring(1));
        } catch (NumberFormatException e) {
            throw new AdapterProtocolException("PICT satır " + row + ", sütun " + column
                    + ": tanınmayan seviye belirteci '" + token + "'", e);
        }
        if (index < 0 || index >= levelCount) {
            throw new AdapterProtocolException("PICT satır " + row + ", sütun " + column
                    + ": seviye indeksi aralık dışında '" + token + "'");
        }
        return index;
    }
}
