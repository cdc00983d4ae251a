package com.caredirectory.providers.model;

import java.util.List;
import java.util.Locale;

/**
 * Fixed category taxonomy. Values are re-seeded into healthcare_category on every refresh and
 * providers reference them by {@link #getValue()}.
 *
 * Keywords are matched against the lower-cased care field column of the register.
 */
public enum HealthcareCategory {

    GENERAL_PRACTITIONER("praktický lékař", List.of("všeobecné praktické lékařství", "praktické lékařství pro dospělé")),
    PAEDIATRICIAN("praktický lékař pro děti a dorost", List.of("praktické lékařství pro děti a dorost")),
    DENTIST("zubní lékař", List.of("zubní lékařství", "stomatologie")),
    GYNECOLOGY("gynekologie", List.of("gynekologie")),
    DERMATOLOGY("dermatologie", List.of("dermatovenerologie", "dermatologie")),
    UROLOGY("urologie", List.of("urologie")),
    OPHTHALMOLOGY("oční lékařství", List.of("oftalmologie", "oční")),
    CARDIOLOGY("kardiologie", List.of("kardiologie")),
    GASTROENTEROLOGY("gastroenterologie", List.of("gastroenterologie")),
    MAMMOGRAPHY("mamografie", List.of("mamografický screening", "mamografie")),
    RADIOLOGY("radiologie", List.of("radiologie a zobrazovací metody")),
    PSYCHIATRY("psychiatrie", List.of("psychiatrie")),
    PHARMACY("lékárna", List.of("lékárenská péče", "farmaceut"));

    private final String value;
    private final List<String> keywords;

    HealthcareCategory(String value, List<String> keywords) {
        this.value = value;
        this.keywords = keywords;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(String careField) {
        if (careField == null || careField.isBlank()) return false;
        String normalised = careField.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(normalised::contains);
    }
}
