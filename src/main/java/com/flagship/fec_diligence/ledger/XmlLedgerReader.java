package com.flagship.fec_diligence.ledger;

import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.filter.Filters;
import org.jdom2.input.SAXBuilder;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads XML FEC exports. Entries are the elements named ecriture, ligne or operation;
 * when a file has no such wrapper, the parents of the account-number elements (CompteNum,
 * Compte or NumCompte) are used.
 */
final class XmlLedgerReader {

    private static final Set<String> ENTRY_TAGS = Set.of("ecriture", "ligne", "operation");

    /** Accepted tag names per column, in normalized form. */
    private static final Map<FecColumn, List<String>> TAG_ALIASES = new EnumMap<>(FecColumn.class);

    static {
        TAG_ALIASES.put(FecColumn.JOURNAL_CODE, List.of("journalcode", "journal", "codejournal"));
        TAG_ALIASES.put(FecColumn.JOURNAL_LIB, List.of("journallib", "libjournal"));
        TAG_ALIASES.put(FecColumn.ECRITURE_NUM, List.of("ecriturenum", "numecriture", "piece"));
        TAG_ALIASES.put(FecColumn.ECRITURE_DATE, List.of("ecrituredate", "date", "dateecriture"));
        TAG_ALIASES.put(FecColumn.COMPTE_NUM, List.of("comptenum", "compte", "numcompte"));
        TAG_ALIASES.put(FecColumn.COMPTE_LIB, List.of("comptelib", "libcompte", "libelle"));
        TAG_ALIASES.put(FecColumn.COMP_AUX_NUM, List.of("compauxnum", "compteauxiliaire"));
        TAG_ALIASES.put(FecColumn.COMP_AUX_LIB, List.of("compauxlib", "libcompteaux"));
        TAG_ALIASES.put(FecColumn.PIECE_REF, List.of("pieceref", "refpiece"));
        TAG_ALIASES.put(FecColumn.PIECE_DATE, List.of("piecedate", "datepiece"));
        TAG_ALIASES.put(FecColumn.ECRITURE_LIB, List.of("ecriturelib", "libecriture", "libelle"));
        TAG_ALIASES.put(FecColumn.DEBIT, List.of("debit", "montantdebit"));
        TAG_ALIASES.put(FecColumn.CREDIT, List.of("credit", "montantcredit"));
        TAG_ALIASES.put(FecColumn.ECRITURE_LET, List.of("ecriturelet", "lettrage"));
        TAG_ALIASES.put(FecColumn.DATE_LET, List.of("datelet", "datelettrage"));
        TAG_ALIASES.put(FecColumn.VALID_DATE, List.of("validdate", "datevalidation"));
        TAG_ALIASES.put(FecColumn.MONTANT_DEVISE, List.of("montantdevise"));
        TAG_ALIASES.put(FecColumn.IDEVISE, List.of("idevise", "devise", "codedevise"));
    }

    private final LedgerRowMapper rowMapper;

    XmlLedgerReader(LedgerRowMapper rowMapper) {
        this.rowMapper = rowMapper;
    }

    List<LedgerEntry> read(String content, ParseDiagnostics diagnostics) throws LedgerFormatException {
        Document document = build(content);

        List<Element> entryElements = new ArrayList<>();
        for (Element element : document.getDescendants(Filters.element())) {
            if (isEntryTag(element) && element.getChildren().stream().noneMatch(XmlLedgerReader::isEntryTag)) {
                entryElements.add(element);
            }
        }
        if (entryElements.isEmpty()) {
            entryElements = parentsOfAccountNumbers(document);
        }
        if (entryElements.isEmpty()) {
            throw new LedgerFormatException(
                "No accounting entries found in XML file. Expected ecriture, ligne or operation elements.");
        }

        List<LedgerEntry> entries = new ArrayList<>();
        int line = 0;
        for (Element element : entryElements) {
            line++;
            rowMapper.map(line, valuesOf(element), diagnostics).ifPresent(entries::add);
        }
        return entries;
    }

    private static boolean isEntryTag(Element element) {
        return ENTRY_TAGS.contains(LedgerValueParser.normalizeHeader(element.getName()));
    }

    private static Document build(String content) throws LedgerFormatException {
        SAXBuilder builder = new SAXBuilder();
        builder.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        builder.setExpandEntities(false);
        try {
            return builder.build(new StringReader(content));
        } catch (JDOMException | IOException e) {
            throw new LedgerFormatException("XML parsing error: " + e.getMessage(), e);
        }
    }

    private static List<Element> parentsOfAccountNumbers(Document document) {
        Set<Element> parents = new LinkedHashSet<>();
        for (Element element : document.getDescendants(Filters.element())) {
            if (TAG_ALIASES.get(FecColumn.COMPTE_NUM).contains(LedgerValueParser.normalizeHeader(element.getName()))
                    && element.getParentElement() != null) {
                parents.add(element.getParentElement());
            }
        }
        return new ArrayList<>(parents);
    }

    private static Map<FecColumn, String> valuesOf(Element entry) {
        Map<String, String> children = new HashMap<>();
        for (Element child : entry.getChildren()) {
            children.putIfAbsent(LedgerValueParser.normalizeHeader(child.getName()), child.getTextTrim());
        }

        Map<FecColumn, String> values = new EnumMap<>(FecColumn.class);
        TAG_ALIASES.forEach((column, aliases) -> {
            for (String alias : aliases) {
                String value = children.get(alias);
                if (value != null) {
                    values.put(column, value);
                    break;
                }
            }
        });
        return values;
    }
}
