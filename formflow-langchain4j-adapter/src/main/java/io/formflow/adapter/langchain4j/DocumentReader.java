package io.formflow.adapter.langchain4j;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentParser;
import dev.langchain4j.data.document.loader.FileSystemDocumentLoader;
import dev.langchain4j.data.document.parser.TextDocumentParser;
import dev.langchain4j.data.document.parser.apache.pdfbox.ApachePdfBoxDocumentParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/// Loads uploaded files as LangChain4j documents, picking the parser by extension.
///
/// `.pdf` goes through Apache PDFBox; everything else is read as plain text.
final class DocumentReader {

    private final DocumentParser pdfParser = new ApachePdfBoxDocumentParser();
    private final DocumentParser textParser = new TextDocumentParser();

    /// Reads and parses a file.
    ///
    /// @param path file to read, not null
    /// @return parsed document, never null
    /// @throws IOException if the file is missing or cannot be parsed
    Document read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        try {
            return FileSystemDocumentLoader.loadDocument(path, parserFor(path));
        } catch (RuntimeException e) {
            throw new IOException("Failed to parse " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private DocumentParser parserFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".pdf") ? pdfParser : textParser;
    }
}
