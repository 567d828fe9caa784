package com.cgi.privsense.requestscanner.config;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only word lists used by the validators and the name extractor.
 * Built once and shared by reference; all lookups are case-insensitive.
 */
public final class PIIVocabulary {

    private static final Set<String> FORBIDDEN_WORDS = Set.of(
            "associação", "associados", "advogados",
            "sociedade", "servidores", "setor",
            "recursos", "coletiva", "magistério",
            "telefônicas", "amostra", "total",
            "temperatura", "fósforo", "nitrogênio",
            "oxigênio", "validador", "sólidos",
            "totais", "gostaria", "gostar", "venho");

    private static final Set<String> NAME_CONNECTORS = Set.of("da", "de", "do", "das", "dos", "e");

    private static final Set<String> HONORIFIC_TITLES = Set.of(
            "dr", "dr.", "dra", "dra.",
            "sr", "sr.", "sra", "sra.",
            "prof", "prof.", "profª", "profª.",
            "doutor", "doutora", "doutorª",
            "doutorª.", "doutor.", "doutora.");

    private static final Set<String> NOISE_SUFFIXES = Set.of("cpf", "cnh", "rg", "nome");

    private static final Set<String> LEADING_PRONOUNS = Set.of("nossa", "nosso", "suas", "seus");

    // Salutations, matched as prefixes of the lower-cased span
    private static final List<String> FORMAL_ADDRESS_PHRASES = List.of(
            "vossa senhoria",
            "vossa excelência",
            "vossa magnificência",
            "vossa alteza",
            "vossa santidade",

            "v. s.", "v.s.",
            "v. exa.", "v.exa.",
            "v. exª", "v.exª",

            "ilustríssimo senhor",
            "ilustríssima senhora",
            "excelentíssimo senhor",
            "excelentíssima senhora",
            "digníssimo senhor",
            "digníssima senhora",
            "meritíssimo juiz",
            "meritíssima juíza",

            "senhor secretário",
            "senhora secretária",
            "senhor ministro",
            "senhora ministra",
            "senhor governador",
            "senhora governadora",
            "senhor prefeito",
            "senhora prefeita",
            "senhor presidente",
            "senhora presidente",

            "senhor juiz",
            "senhora juíza",
            "senhor desembargador",
            "senhora desembargadora",
            "senhor promotor",
            "senhora promotora",
            "senhor procurador",
            "senhora procuradora",

            "ilustres senhores",
            "ilustres senhoras",
            "vossas senhorias",
            "vossas excelências");

    private static final List<String> IDENTITY_DOCUMENT_KEYWORDS = List.of("rg", "registro geral", "identidade");

    private static final List<String> ADDRESS_KEYWORDS = List.of("rua", "avenida", "av", "quadra", "lote", "bloco");

    private final Set<String> forbiddenWords;
    private final Set<String> nameConnectors;
    private final Set<String> honorificTitles;
    private final Set<String> noiseSuffixes;
    private final Set<String> leadingPronouns;
    private final List<String> formalAddressPhrases;
    private final List<String> identityDocumentKeywords;
    private final List<String> addressKeywords;

    private PIIVocabulary(Set<String> forbiddenWords, Set<String> nameConnectors, Set<String> honorificTitles,
                          Set<String> noiseSuffixes, Set<String> leadingPronouns, List<String> formalAddressPhrases,
                          List<String> identityDocumentKeywords, List<String> addressKeywords) {
        this.forbiddenWords = Set.copyOf(forbiddenWords);
        this.nameConnectors = Set.copyOf(nameConnectors);
        this.honorificTitles = Set.copyOf(honorificTitles);
        this.noiseSuffixes = Set.copyOf(noiseSuffixes);
        this.leadingPronouns = Set.copyOf(leadingPronouns);
        this.formalAddressPhrases = List.copyOf(formalAddressPhrases);
        this.identityDocumentKeywords = List.copyOf(identityDocumentKeywords);
        this.addressKeywords = List.copyOf(addressKeywords);
    }

    /**
     * Vocabulary for Brazilian Portuguese request records.
     *
     * @return Default vocabulary
     */
    public static PIIVocabulary defaults() {
        return new PIIVocabulary(FORBIDDEN_WORDS, NAME_CONNECTORS, HONORIFIC_TITLES, NOISE_SUFFIXES,
                LEADING_PRONOUNS, FORMAL_ADDRESS_PHRASES, IDENTITY_DOCUMENT_KEYWORDS, ADDRESS_KEYWORDS);
    }

    public boolean isForbiddenWord(String token) {
        return forbiddenWords.contains(lower(token));
    }

    public boolean isNameConnector(String token) {
        return nameConnectors.contains(lower(token));
    }

    public boolean isHonorificTitle(String token) {
        return honorificTitles.contains(lower(token));
    }

    /**
     * Noise labels such as "CPF:" left dangling after a name. A trailing
     * colon is ignored.
     */
    public boolean isNoiseSuffix(String token) {
        String normalized = lower(token);
        int end = normalized.length();
        while (end > 0 && normalized.charAt(end - 1) == ':') {
            end--;
        }
        int start = 0;
        while (start < end && normalized.charAt(start) == ':') {
            start++;
        }
        return noiseSuffixes.contains(normalized.substring(start, end));
    }

    public boolean isLeadingPronoun(String token) {
        return leadingPronouns.contains(lower(token));
    }

    public boolean startsWithFormalAddress(String text) {
        String normalized = lower(text);
        return formalAddressPhrases.stream().anyMatch(normalized::startsWith);
    }

    /**
     * Checks whether a lower-cased context window mentions an identity document.
     */
    public boolean mentionsIdentityDocument(String window) {
        String normalized = lower(window);
        return identityDocumentKeywords.stream().anyMatch(normalized::contains);
    }

    public boolean mentionsAddressKeyword(String text) {
        String normalized = lower(text);
        return addressKeywords.stream().anyMatch(normalized::contains);
    }

    public List<String> getFormalAddressPhrases() {
        return formalAddressPhrases;
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
