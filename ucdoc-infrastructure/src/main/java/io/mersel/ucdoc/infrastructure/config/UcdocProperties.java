package io.mersel.ucdoc.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;

/**
 * UCDoc yapılandırma özellikleri.
 * <p>
 * {@code ucdoc} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code pict.command}: Kombinasyon üreticisi komutu; boşlukla ayrılmış argümanlar içerebilir,
 *       boşluk içeren parçalar tek veya çift tırnakla yazılır (varsayılan: pict)</li>
 *   <li>{@code pict.work-dir}: İstek dosyalarının yazılacağı dizin (boşsa sistem geçici dizini)</li>
 *   <li>{@code pict.timeout-ms}: Süreç zaman aşımı (pozitif olmalı)</li>
 *   <li>{@code validation.strict}: Kapsam boşluklarında yüklemeyi durdur (varsayılan: false)</li>
 *   <li>{@code keyword.replacement-format}: {@code ${...}} anahtar kelimelerinin yerine yazılacak biçim; tek bir {@code %s} ile biçimlenebilmeli</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "ucdoc")
public class UcdocProperties {

    private static final Logger log = LoggerFactory.getLogger(UcdocProperties.class);

    static final String DEFAULT_REPLACEMENT_FORMAT = "「%s」";

    private final Pict pict = new Pict();
    private final Validation validation = new Validation();
    private final Keyword keyword = new Keyword();

    @PostConstruct
    void validate() {
        if (pict.timeoutMs <= 0) {
            log.warn("pict.timeout-ms değeri pozitif olmalı (verilen: {}), varsayılan 60000 ms kullanılıyor", pict.timeoutMs);
            pict.timeoutMs = 60000;
        }
        if (pict.command == null || pict.command.isBlank()) {
            log.warn("pict.command boş, varsayılan 'pict' kullanılıyor");
            pict.command = "pict";
        }
        if (!isUsableFormat(keyword.replacementFormat)) {
            log.warn("keyword.replacement-format tek bir '%s' ile biçimlenebilmeli (verilen: {}), varsayılan kullanılıyor",
                    keyword.replacementFormat);
            keyword.replacementFormat = DEFAULT_REPLACEMENT_FORMAT;
        }
    }

    private static boolean isUsableFormat(String format) {
        if (format == null || !format.contains("%s")) {
            return false;
        }
        try {
            String.format(format, "x");
            return true;
        } catch (IllegalFormatException e) {
            return false;
        }
    }

    public Pict getPict() {
        return pict;
    }

    public Validation getValidation() {
        return validation;
    }

    public Keyword getKeyword() {
        return keyword;
    }

    public static class Pict {

        private String command = "pict";
        private String workDir = "";
        private long timeoutMs = 60000;

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        /**
         * Komutu argümanlarına ayırır. Tırnak içindeki boşluklar ayırıcı sayılmaz,
         * tırnakların kendisi atılır.
         */
        public List<String> getCommandLine() {
            List<String> parts = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inToken = false;
            char quote = 0;
            for (char c : command.trim().toCharArray()) {
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    } else {
                        current.append(c);
                    }
                } else if (c == '"' || c == '\'') {
                    quote = c;
                    inToken = true;
                } else if (Character.isWhitespace(c)) {
                    if (inToken) {
                        parts.add(current.toString());
                        current.setLength(0);
                        inToken = false;
                    }
                } else {
                    current.append(c);
                    inToken = true;
                }
            }
            if (inToken) {
                parts.add(current.toString());
            }
            return parts;
        }

        public String getWorkDir() {
            return workDir;
        }

        public void setWorkDir(String workDir) {
            this.workDir = workDir;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Validation {

        private boolean strict = false;

        public boolean isStrict() {
            return strict;
        }

        public void setStrict(boolean strict) {
            this.strict = strict;
        }
    }

    public static class Keyword {

        private String replacementFormat = DEFAULT_REPLACEMENT_FORMAT;

        public String getReplacementFormat() {
            return replacementFormat;
        }

        public void setReplacementFormat(String replacementFormat) {
            this.replacementFormat = replacementFormat;
        }
    }
}
