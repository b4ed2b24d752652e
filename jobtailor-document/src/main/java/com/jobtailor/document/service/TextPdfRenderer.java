package com.jobtailor.document.service;

import com.jobtailor.common.exception.DocumentRenderException;
import com.jobtailor.document.config.DocumentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 PDFBox 的纯文本 PDF 渲染器（Letter 纸张，Helvetica 字体）。
 * <p>
 * 排版规则：
 * <ul>
 *   <li>空行：插入固定留白</li>
 *   <li>全大写短行（如 EXPERIENCE）：粗体一级标题</li>
 *   <li>以冒号结尾的短行：粗体二级标题</li>
 *   <li>其余：正文，按页面宽度自动折行，写满自动换页</li>
 * </ul>
 * 标准 14 字体无法编码的字符（中文、emoji 等）替换为 '?'。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextPdfRenderer implements PdfRenderer {

    private final DocumentProperties properties;

    @Override
    public byte[] render(String text, String title) {
        PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            document.getDocumentInformation().setTitle(title);
            PageWriter writer = new PageWriter(document);
            try {
                String source = text == null ? "" : text;
                for (String rawLine : source.split("\\r?\\n", -1)) {
                    String line = rawLine.strip();
                    if (line.isEmpty()) {
                        writer.skip(properties.getBlankLineSpacing());
                    } else if (isHeading(line)) {
                        writer.paragraph(line, bold, properties.getHeadingFontSize());
                    } else if (isSubheading(line)) {
                        writer.paragraph(line, bold, properties.getSubheadingFontSize());
                    } else {
                        writer.paragraph(line, regular, properties.getBodyFontSize());
                    }
                }
            } finally {
                writer.close();
            }

            document.save(out);
            log.info("已生成 PDF: {} ({} 页, {} bytes)", title, document.getNumberOfPages(), out.size());
            return out.toByteArray();

        } catch (IOException e) {
            throw new DocumentRenderException("生成 PDF 失败: " + title, e);
        }
    }

    boolean isHeading(String line) {
        if (line.length() >= properties.getMaxHeadingLength()) {
            return false;
        }
        boolean hasLetter = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                hasLetter = true;
            }
        }
        return hasLetter;
    }

    boolean isSubheading(String line) {
        return line.endsWith(":") && line.length() < properties.getMaxHeadingLength();
    }

    /**
     * 维护当前页、内容流和纵向游标。
     */
    private final class PageWriter {

        private final PDDocument document;
        private final Map<PDFont, Map<Integer, Boolean>> encodable = new HashMap<>();
        private PDPageContentStream stream;
        private float width;
        private float y;

        PageWriter(PDDocument document) throws IOException {
            this.document = document;
            newPage();
        }

        void skip(float height) throws IOException {
            ensureRoom(height);
            y -= height;
        }

        void paragraph(String line, PDFont font, float fontSize) throws IOException {
            float leading = Math.max(properties.getBodyLeading(), fontSize * 1.25f);
            for (String wrapped : wrap(sanitize(line, font), font, fontSize)) {
                ensureRoom(leading);
                y -= leading;
                stream.beginText();
                stream.setFont(font, fontSize);
                stream.newLineAtOffset(properties.getMargin(), y);
                stream.showText(wrapped);
                stream.endText();
            }
            y -= properties.getParagraphSpacing();
        }

        void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        private void ensureRoom(float height) throws IOException {
            if (y - height < properties.getMargin()) {
                newPage();
            }
        }

        private void newPage() throws IOException {
            close();
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            width = page.getMediaBox().getWidth() - 2 * properties.getMargin();
            y = page.getMediaBox().getHeight() - properties.getMargin();
        }

        private List<String> wrap(String line, PDFont font, float fontSize) throws IOException {
            List<String> lines = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (String word : line.split(" +")) {
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (textWidth(candidate, font, fontSize) <= width) {
                    current.setLength(0);
                    current.append(candidate);
                    continue;
                }
                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                // 单个词超过整行宽度时按字符硬折
                String rest = word;
                while (rest.length() > 1 && textWidth(rest, font, fontSize) > width) {
                    int cut = rest.length() - 1;
                    while (cut > 1 && textWidth(rest.substring(0, cut), font, fontSize) > width) {
                        cut--;
                    }
                    lines.add(rest.substring(0, cut));
                    rest = rest.substring(cut);
                }
                current.append(rest);
            }
            if (current.length() > 0) {
                lines.add(current.toString());
            }
            return lines;
        }

        private float textWidth(String text, PDFont font, float fontSize) throws IOException {
            return font.getStringWidth(text) / 1000f * fontSize;
        }

        private String sanitize(String line, PDFont font) throws IOException {
            Map<Integer, Boolean> cache = encodable.computeIfAbsent(font, f -> new HashMap<>());
            StringBuilder sb = new StringBuilder(line.length());
            for (int cp : line.replace('\t', ' ').codePoints().toArray()) {
                Boolean ok = cache.get(cp);
                if (ok == null) {
                    ok = canEncode(font, cp);
                    cache.put(cp, ok);
                }
                sb.append(ok ? new String(Character.toChars(cp)) : "?");
            }
            return sb.toString();
        }

        private boolean canEncode(PDFont font, int codePoint) throws IOException {
            if (Character.isISOControl(codePoint)) {
                return false;
            }
            try {
                font.encode(new String(Character.toChars(codePoint)));
                return true;
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
    }
}
