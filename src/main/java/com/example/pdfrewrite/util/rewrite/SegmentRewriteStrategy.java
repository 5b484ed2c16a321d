package com.example.pdfrewrite.util.rewrite;

import com.example.pdfrewrite.util.rewrite.dto.RewriteOutcome;
import com.example.pdfrewrite.util.rewrite.dto.SegmentEdit;
import com.example.pdfrewrite.util.stream.dto.TextSegment;
import org.apache.pdfbox.cos.COSBase;

import java.util.List;

/**
 * 文本段改写策略
 *
 * 实现不修改传入的 token，只返回替换结果；无法处理时返回失败结果而不是抛异常，
 * 由 {@link TokenRewriter} 按顺序尝试下一个策略。
 */
public interface SegmentRewriteStrategy {

    RewriteStrategyKind kind();

    /**
     * @param segment  待改写的文本段
     * @param operands 该段文本显示操作符的原操作数
     * @param edits    段内编辑，按起点升序且互不重叠
     * @param context  页面改写上下文（字体解析、替代字体资源）
     * @return 改写结果
     */
    RewriteOutcome rewrite(TextSegment segment, List<COSBase> operands, List<SegmentEdit> edits, RewriteContext context);
}
