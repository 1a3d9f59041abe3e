package com.adlanda.ragassistant.service.extraction;

import com.adlanda.ragassistant.model.DocumentFormat;
import com.adlanda.ragassistant.model.Page;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.DublinCore;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.microsoft.OfficeParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * {@link TextExtractor} for Word documents (DOCX and DOC), using Apache Tika.
 *
 * <p>Tika renders the document as XHTML events. Paragraph text and table-cell text are
 * collected separately, each in document order, and then concatenated paragraphs first.
 *
 * <p>Word files carry no page layout, so pages are synthesized: text is accumulated and a page
 * is cut each time the buffer exceeds {@value #SYNTHETIC_PAGE_CHARS} characters. These are
 * approximate page numbers, not the ones Word would print.
 */
@Service
public class OfficeTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(OfficeTextExtractor.class);

    static final int SYNTHETIC_PAGE_CHARS = 3000;

    private static final Set<String> PARAGRAPH_TAGS = Set.of("p", "h1", "h2", "h3", "h4", "h5", "h6", "li");

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public ExtractionResult extract(byte[] bytes) {
        BlockCollector collector = new BlockCollector();
        Metadata metadata = new Metadata();

        try (InputStream inputStream = new ByteArrayInputStream(bytes)) {
            parser.parse(inputStream, collector, metadata, parseContext());
        } catch (IOException | SAXException | TikaException e) {
            log.error("Tika parsing failed: {}", e.getMessage());
            return new ExtractionResult.Failed("Failed to parse Word document: " + e.getMessage(), e);
        }

        String contentType = metadata.get(Metadata.CONTENT_TYPE);
        if (!isWordDocument(contentType)) {
            log.warn("Detected content type {} is not a Word document", contentType);
            return new ExtractionResult.Failed("Not a Word document (detected " + contentType + ")", null);
        }

        List<String> blocks = new ArrayList<>(collector.paragraphs);
        blocks.addAll(collector.cells);
        List<Page> pages = paginate(blocks);

        DocumentInfo info = new DocumentInfo(
                metadata.get(TikaCoreProperties.TITLE),
                metadata.get(TikaCoreProperties.CREATOR),
                metadata.get(DublinCore.SUBJECT),
                pages.size()
        );
        log.info("Extracted {} paragraphs and {} table cells into {} pages",
                collector.paragraphs.size(), collector.cells.size(), pages.size());

        return ExtractionResult.of(pages, info);
    }

    @Override
    public boolean supports(DocumentFormat format) {
        return format == DocumentFormat.DOCX || format == DocumentFormat.DOC;
    }

    static List<Page> paginate(List<String> blocks) {
        List<Page> pages = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();

        for (String block : blocks) {
            buffer.append(block).append("\n\n");
            if (buffer.length() > SYNTHETIC_PAGE_CHARS) {
                pages.add(new Page(pages.size() + 1, buffer.toString().strip()));
                buffer.setLength(0);
            }
        }

        if (!buffer.toString().isBlank()) {
            pages.add(new Page(pages.size() + 1, buffer.toString().strip()));
        }
        return pages;
    }

    private ParseContext parseContext() {
        OfficeParserConfig config = new OfficeParserConfig();
        config.setIncludeHeadersAndFooters(false);

        ParseContext context = new ParseContext();
        context.set(OfficeParserConfig.class, config);
        return context;
    }

    private boolean isWordDocument(String contentType) {
        return contentType != null
                && (contentType.contains("wordprocessingml") || contentType.contains("msword"));
    }

    /**
     * Collects non-blank paragraph text outside tables and non-blank table-cell text.
     */
    private static final class BlockCollector extends DefaultHandler {

        private final List<String> paragraphs = new ArrayList<>();
        private final List<String> cells = new ArrayList<>();

        private final StringBuilder paragraph = new StringBuilder();
        private StringBuilder cell;
        private int tableDepth;
        private boolean inParagraph;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            String tag = tagName(localName, qName);
            if ("table".equals(tag)) {
                tableDepth++;
            } else if (("td".equals(tag) || "th".equals(tag)) && cell == null) {
                cell = new StringBuilder();
            } else if (PARAGRAPH_TAGS.contains(tag) && tableDepth == 0) {
                paragraph.setLength(0);
                inParagraph = true;
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            String tag = tagName(localName, qName);
            if ("table".equals(tag)) {
                tableDepth = Math.max(0, tableDepth - 1);
            } else if ("td".equals(tag) || "th".equals(tag)) {
                if (cell != null && tableDepth <= 1) {
                    addIfNotBlank(cells, cell.toString());
                    cell = null;
                }
            } else if (PARAGRAPH_TAGS.contains(tag)) {
                if (tableDepth > 0) {
                    if (cell != null) {
                        cell.append('\n');
                    }
                } else if (inParagraph) {
                    addIfNotBlank(paragraphs, paragraph.toString());
                    inParagraph = false;
                }
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (tableDepth > 0) {
                if (cell != null) {
                    cell.append(ch, start, length);
                }
            } else if (inParagraph) {
                paragraph.append(ch, start, length);
            }
        }

        private static String tagName(String localName, String qName) {
            String name = localName != null && !localName.isEmpty() ? localName : qName;
            return name.toLowerCase(Locale.ROOT);
        }

        private static void addIfNotBlank(List<String> target, String text) {
            String trimmed = text.strip();
            if (!trimmed.isEmpty()) {
                target.add(trimmed);
            }
        }
    }
}
