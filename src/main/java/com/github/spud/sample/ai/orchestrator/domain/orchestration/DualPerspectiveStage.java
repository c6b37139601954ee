package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentRequest;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * 生成 → 评审 → 综合 三步流水线
 * <p>
 * 不打分、不重试，任一步骤失败直接向上抛出。
 */
@Slf4j
public class DualPerspectiveStage {

  static final String GENERATE_SUFFIX =
    "\n\nGenerate a complete, working solution. Be thorough and innovative.";

  static final String CRITIQUE_TEMPLATE = "Review the following solution for:\n"
    + "- Correctness and bugs\n"
    + "- Edge cases and error handling\n"
    + "- Performance issues\n"
    + "- Security concerns\n"
    + "- Code quality\n\n"
    + "Provide a numbered list of specific issues.\n\n"
    + "Solution:\n\n";

  static final String SYNTHESIZE_TEMPLATE = "Original solution:\n\n%s\n\n"
    + "Critical analysis identified these issues:\n%s\n\n"
    + "Please produce a corrected, polished final solution that addresses all identified issues.";

  private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*(\\d+)[.)]\\s+(.*)$");

  public DualPerspectiveResult run(String basePrompt, AgentCaller agentCaller,
    AgentProfile creatorProfile, AgentProfile criticProfile, AgentProfile synthesizerProfile,
    CancellationToken token) throws Exception {
    token.throwIfCancelled();
    log.info("Dual-perspective: generating");
    String generated = agentCaller.call(
      AgentRequest.of(basePrompt + GENERATE_SUFFIX, creatorProfile), token).getText();

    token.throwIfCancelled();
    log.info("Dual-perspective: critiquing {} chars", generated.length());
    String critique = agentCaller.call(
      AgentRequest.of(CRITIQUE_TEMPLATE + generated, criticProfile), token).getText();
    List<String> issues = parseIssues(critique);

    token.throwIfCancelled();
    log.info("Dual-perspective: synthesizing with {} issues", issues.size());
    String synthesized = agentCaller.call(
      AgentRequest.of(String.format(SYNTHESIZE_TEMPLATE, generated, critique), synthesizerProfile),
      token).getText();

    return new DualPerspectiveResult(generated, critique, synthesized, issues,
      new DualPerspectiveResult.Metadata(generated.length(), critique.length(),
        synthesized.length()));
  }

  /**
   * 从评审文本中提取编号列表项（"1. xxx" 或 "1) xxx"）
   */
  static List<String> parseIssues(String critique) {
    List<String> issues = new ArrayList<>();
    if (critique == null) {
      return issues;
    }
    for (String line : critique.split("\\R")) {
      Matcher matcher = NUMBERED_ITEM.matcher(line);
      if (matcher.matches()) {
        String issue = matcher.group(2).trim();
        if (!issue.isEmpty()) {
          issues.add(issue);
        }
      }
    }
    return issues;
  }
}
