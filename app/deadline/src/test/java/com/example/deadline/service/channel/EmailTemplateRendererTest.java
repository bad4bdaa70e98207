package com.example.deadline.service.channel;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.deadline.config.EmailChannelProperties;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmailTemplateRendererTest {

  private final EmailTemplateRenderer renderer =
      new EmailTemplateRenderer(new EmailChannelProperties(true, null, "QA <System>"));

  @Test
  void escapesContentAndKeepsLineBreaks() {
    final String html = renderer.render("Alert & notice", "line one\n<b>line two</b>", Map.of());

    assertThat(html)
        .contains("<h2>Alert &amp; notice</h2>")
        .contains("line one<br>&lt;b&gt;line two&lt;/b&gt;")
        .contains("<h1>QA &lt;System&gt;</h1>")
        .doesNotContain("Take Action");
  }

  @Test
  void rendersActionLinkFromMetadata() {
    final String html =
        renderer.render("t", "m", Map.of("actionUrl", "https://qa.example.edu/evaluate?a=1&b=2"));

    assertThat(html)
        .contains("<a href=\"https://qa.example.edu/evaluate?a=1&amp;b=2\" class=\"btn\">Take Action</a>");
  }
}
