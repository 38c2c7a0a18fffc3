package com.kmg.dms.service;

import com.kmg.dms.model.Classification;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Static filename table for payroll exports. Patterns are case-insensitive substrings; the first entry with a
 * matching pattern wins.
 */
@Service
public class DocumentClassifier {

    private static final List<Entry> TABLE = List.of(
            entry("LOHNSCHEINE", true, "05.01", "Lohnabrechnung",
                    "Lohnscheine", "Korrekturlohnscheine"),
            entry("LOHNSTEUERBESCHEINIGUNG", true, "05.02", "Lohnsteuerbescheinigung",
                    "Elektronische Lohnsteuerbescheinigung", "Lohnsteuerbescheinigung"),
            entry("MELDEBESCHEINIGUNG", true, "05.03", "SV-Meldebescheinigung (DEÜV)",
                    "Meldebescheinigung"),
            entry("ENTGELTBESCHEINIGUNG", true, "07.01", "Entgeltbescheinigung",
                    "Entgeltbescheinigung"),
            entry("BEITRAGSNACHWEIS", false, "05.03", "Beitragsnachweis",
                    "Beitragsnachweis", "Protokoll Beitragsnachweis"),
            entry("LOHNSTEUERANMELDUNG", false, "05.02", "Lohnsteueranmeldung",
                    "Lohnsteueranmeldung"),
            entry("FIBU", false, "05.04", "Fibu-Buchungen",
                    "Fibu-Journal", "Fibu-Buchungsjournal"),
            entry("LOHNJOURNAL", false, "05.01", "Lohnjournal",
                    "Lohnjournal", "Jahreslohnjournal"),
            entry("LOHNKONTO", true, "05.01", "Lohnkonto",
                    "Lohnkonto", "Jahreslohnkonto", "erweitertes Lohnkonto"),
            entry("BERUFSGENOSSENSCHAFT", false, "07.05", "Berufsgenossenschaft/Unfallmeldungen",
                    "Berufsgenossenschaftsliste", "Jahreslohnnachweis Berufsgenossenschaft"),
            entry("ELSTAM", false, "05.02", "ELStAM-Meldung",
                    "ELStAM"),
            entry("ERSTATTUNG", false, "05.03", "Erstattungsantrag U1/U2",
                    "Erstattungsantrag"),
            entry("KUG", false, "06.03", "Kurzarbeitergeld",
                    "Saison-KUG", "Saison-Kug"),
            entry("STUNDENKALENDARIUM", false, "06.01", "Arbeitszeitnachweise",
                    "Stundenkalendarium", "Soll-Istprotokoll"),
            entry("ZVK", false, "05.05", "ZVK-Beitragsliste (Altersvorsorge)",
                    "ZVK-LAK"),
            entry("DIFFERENZABRECHNUNG", false, "05.01", "Differenzabrechnung",
                    "Differenzabrechnung"),
            entry("RESTURLAUB", false, "06.01", "Urlaubsübersicht",
                    "Resturlaub"),
            entry("LST_JAHRESAUSGLEICH", false, "05.02", "Lohnsteuer-Jahresausgleich",
                    "LSt-Jahresausgleich"),
            entry("BUCHUNGSSTAPEL", false, "05.04", "DATEV-Export",
                    "EXTF_Buchungsstapel", "Buchungsstapel"),
            entry("SAGE_EXPORT", false, "05.04", "Sage-Export",
                    "E_Sage_"),
            entry("BEITRAGSSCHULD", false, "05.03", "Beitragsschuld-Berechnung",
                    "Berechnung voraussichtliche Beitragsschuld", "Beitragsschuld"),
            entry("BEITRAGSLISTE", false, "05.03", "Beitragsliste",
                    "Beitragsliste")
    );

    public Classification classify(String filename) {
        if (filename == null || filename.isBlank()) {
            return Classification.unknown();
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (Entry entry : TABLE) {
            for (String pattern : entry.patterns()) {
                if (lower.contains(pattern)) {
                    return entry.classification();
                }
            }
        }
        return Classification.unknown();
    }

    private static Entry entry(String type, boolean subjectSpecific, String category, String description,
                               String... patterns) {
        return new Entry(
                new Classification(type, subjectSpecific, category, description),
                List.of(patterns).stream().map(p -> p.toLowerCase(Locale.ROOT)).toList()
        );
    }

    private record Entry(Classification classification, List<String> patterns) {
    }
}
