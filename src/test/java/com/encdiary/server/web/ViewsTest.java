package com.encdiary.server.web;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class ViewsTest {

    @Test
    void escapeHtml_neutralisesMarkup() {
        assertEquals("&lt;script&gt;alert(&quot;x&quot;) &amp; &#39;y&#39;&lt;/script&gt;",
                Views.escapeHtml("<script>alert(\"x\") & 'y'</script>"));
        assertEquals("", Views.escapeHtml(null));
    }

    @Test
    void renderFlashes_emitsOneDivPerMessageInOrder() {
        String html = Views.renderFlashes(List.of(
                new Flash(Flash.WARNING, "first"),
                new Flash(Flash.INFO, "<second>")));

        assertEquals("<div class=\"flash warning\">first</div><div class=\"flash info\">&lt;second&gt;</div>", html);
    }
}
