package org.ctl.extraction;

import org.ctl.translation.DialectConfig;
import org.ctl.translation.PropositionInterner;
import org.ctl.translation.TranslatedProperty;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Scrittura dei file di output: una formula per riga, nell'ordine delle proprietà.
 *
 * Il terminatore del dialetto separa le istruzioni, quindi segue ogni formula tranne l'ultima
 * del file; nel dialetto simbolico è vuoto e le righe contengono solo la formula.
 */
public class PropertyFileWriter {

    /**
     * Righe del file per un elenco di proprietà già tradotte nel dialetto indicato.
     */
    public static List<String> renderLines(List<TranslatedProperty> properties, DialectConfig dialect) {
        List<String> lines = new ArrayList<>(properties.size());
        for (int i = 0; i < properties.size(); i++) {
            String formula = properties.get(i).formula();
            lines.add(i < properties.size() - 1 ? formula + dialect.terminator() : formula);
        }
        return lines;
    }

    /**
     * Scrive le proprietà nel file indicato, creando le directory mancanti.
     * Un elenco vuoto non produce alcun file.
     *
     * @return true se il file è stato scritto
     * @throws IOException se la scrittura fallisce
     */
    public boolean write(Path target, List<TranslatedProperty> properties, DialectConfig dialect) throws IOException {
        if (properties.isEmpty()) {
            return false;
        }
        writeLines(target, renderLines(properties, dialect));
        return true;
    }

    /**
     * Esporta la tabella delle proposizioni: una riga "simbolo TAB chiave canonica" per voce.
     *
     * @return true se il file è stato scritto (tabella non vuota)
     * @throws IOException se la scrittura fallisce
     */
    public boolean writeTable(Path target, PropositionInterner interner) throws IOException {
        if (interner.size() == 0) {
            return false;
        }
        writeLines(target, interner.toTableLines());
        return true;
    }

    private static void writeLines(Path target, List<String> lines) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, lines, StandardCharsets.UTF_8);
    }
}
