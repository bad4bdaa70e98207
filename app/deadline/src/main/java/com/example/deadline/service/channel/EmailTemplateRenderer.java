/*
 * Where: Deadline delivery channels
 * What: Renders the HTML body of notification emails
 * Why: Titles and messages carry user-entered names, so everything is escaped before layout
 */
package com.example.deadline.service.channel;

import com.example.deadline.config.EmailChannelProperties;
import com.example.deadline.service.NotificationService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class EmailTemplateRenderer {

  private static final String TEMPLATE =
      """
      <!DOCTYPE html>
      <html lang="en">
      <head>
        <meta charset="UTF-8">
        <meta name="viewport" content="width=device-width, initial-scale=1.0">
        <title>%1$s</title>
        <style>
          body { font-family: Arial, sans-serif; line-height: 1.6; color: #333; }
          .container { max-width: 600px; margin: 0 auto; padding: 20px; }
          .header { background-color: #f8f9fa; padding: 20px; border-radius: 5px; margin-bottom: 20px; }
          .content { padding: 20px 0; }
          .footer { background-color: #f8f9fa; padding: 15px; border-radius: 5px; margin-top: 20px; font-size: 12px; color: #666; }
          .btn { display: inline-block; padding: 10px 20px; background-color: #007bff; color: white; text-decoration: none; border-radius: 5px; margin: 10px 0; }
        </style>
      </head>
      <body>
        <div class="container">
          <div class="header">
            <h1>%2$s</h1>
            <h2>%1$s</h2>
          </div>
          <div class="content">
            <p>%3$s</p>
            %4$s
          </div>
          <div class="footer">
            <p>This is an automated notification from the %2$s.</p>
            <p>Please do not reply to this email.</p>
          </div>
        </div>
      </body>
      </html>
      """;

  private final EmailChannelProperties properties;

  public String render(String subject, String message, Map<String, Object> metadata) {
    final String body = HtmlUtils.htmlEscape(message == null ? "" : message).replace("\n", "<br>");
    return TEMPLATE.formatted(
        HtmlUtils.htmlEscape(subject == null ? "" : subject),
        HtmlUtils.htmlEscape(properties.systemName()),
        body,
        actionLink(metadata));
  }

  private String actionLink(Map<String, Object> metadata) {
    final Object actionUrl = metadata == null ? null : metadata.get(NotificationService.ACTION_URL);
    if (actionUrl == null || actionUrl.toString().isBlank()) {
      return "";
    }
    return "<a href=\"" + HtmlUtils.htmlEscape(actionUrl.toString()) + "\" class=\"btn\">Take Action</a>";
  }
}
