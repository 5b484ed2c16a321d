package com.example.pdfrewrite.service;

import com.example.pdfrewrite.exception.RenderException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * PDF 文档句柄
 *
 * 封装一次渲染用到的文档操作：读写页面内容流 token、页面资源、序列化。
 * 必须在 try-with-resources 中使用，任何退出路径都会释放文档。
 *
 * <pre>
 * try (PdfDocumentHandle handle = PdfDocumentHandle.open(bytes)) {
 *     List&lt;Object&gt; tokens = handle.readTokens(0);
 *     ...
 *     handle.writeTokens(0, tokens);
 *     return handle.toBytes();
 * }
 * </pre>
 */
public class PdfDocumentHandle implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentHandle.class);

    private final PDDocument document;

    private PdfDocumentHandle(PDDocument document) {
        this.document = document;
    }

    /**
     * 从字节打开文档
     *
     * @throws RenderException 字节无法解析为 PDF
     */
    public static PdfDocumentHandle open(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new RenderException("输入 PDF 为空");
        }
        try {
            PDDocument document = Loader.loadPDF(pdfBytes);
            log.debug("PDF 已打开: {} 页, {} 字节", document.getNumberOfPages(), pdfBytes.length);
            return new PdfDocumentHandle(document);
        } catch (IOException e) {
            throw new RenderException("无法打开输入 PDF: " + e.getMessage(), e);
        }
    }

    public PDDocument getDocument() {
        return document;
    }

    public int getPageCount() {
        return document.getNumberOfPages();
    }

    public PDPage getPage(int pageIndex) {
        return document.getPage(pageIndex);
    }

    /**
     * 解析页面内容流为操作数与操作符序列
     */
    public List<Object> readTokens(int pageIndex) throws IOException {
        PDFStreamParser parser = new PDFStreamParser(getPage(pageIndex));
        return parser.parse();
    }

    /**
     * 用 token 序列替换页面内容流（Flate 压缩）
     */
    public void writeTokens(int pageIndex, List<Object> tokens) throws IOException {
        PDPage page = getPage(pageIndex);
        PDStream stream = new PDStream(document);
        try (OutputStream out = stream.createOutputStream(COSName.FLATE_DECODE)) {
            new ContentStreamWriter(out).writeTokens(tokens);
        }
        page.setContents(stream);
    }

    /**
     * 页面资源，没有时创建一个空资源字典
     */
    public PDResources resources(int pageIndex) {
        PDPage page = getPage(pageIndex);
        PDResources resources = page.getResources();
        if (resources == null) {
            resources = new PDResources();
            page.setResources(resources);
        }
        return resources;
    }

    /**
     * 序列化整个文档
     */
    public byte[] toBytes() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
