package sp.sistemaspalacios.api_timeledger.service.timeaccounting.rule;

import java.util.Locale;
import java.util.Optional;

public enum RuleSource {
    SHIFT,
    WEEKLY,
    WORK_RULE;

    /** Valor guardado del ajuste; vacío si no se reconoce. */
    public static Optional<RuleSource> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (RuleSource source : values()) {
            if (source.name().equals(normalized)) return Optional.of(source);
        }
        return Optional.empty();
    }
}
