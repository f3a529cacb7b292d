package com.williamcallahan.reverse_image_search.provider;

import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.testutil.Fixtures;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class EShuushuuProviderTest {

    private static final String PAGE = """
        <html><body>
        <div class="image_thread display">
          <div class="thumb">
            <a class="thumb_image" href="/images/2021-01-01-1024.jpeg"><img src="/thumbs/2021-01-01-1024.jpeg"></a>
          </div>
          <div class="meta">
            <dl>
              <dt>Submitted By:</dt><dd><a href="/user/1">uploader</a></dd>
              <dt>Tags:</dt>
              <dd class="quicktag"><span class="tag">"<a href="/tags/1">long hair</a>"</span> <span class="tag">"<a href="/tags/2">smile</a>"</span></dd>
              <dt>Source:</dt>
              <dd class="quicktag"><span class="tag">"<a href="/tags/3">Original</a>"</span></dd>
              <dt>Characters:</dt>
              <dd class="quicktag"><span class="tag">"<a href="/tags/4">Someone</a>"</span></dd>
              <dt>Artist:</dt>
              <dd class="quicktag"><span class="tag">"<a href="/tags/5">Painter</a>"</span></dd>
            </dl>
          </div>
        </div>
        </body></html>
        """;

    private final EShuushuuProvider provider = new EShuushuuProvider(mock(WebClient.class), new SearchConfigurationProperties());

    @Test
    void toProviderData_readsImagePage() {
        Optional<ProviderData> result = provider.toProviderData("1024", EShuushuuProvider.pageUrl("1024"), PAGE,
            Fixtures.parse("{\"post_link\": \"https://e-shuushuu.net/image/1024/\"}"));

        assertTrue(result.isPresent());
        ProviderData data = result.get();
        assertEquals("eshuushuu:1024", data.getProviderId());
        assertEquals("https://e-shuushuu.net/image/1024/", data.getProviderLink());
        assertEquals(List.of("https://e-shuushuu.net/images/2021-01-01-1024.jpeg"), data.getMainFiles());
        assertEquals(List.of("long hair", "smile"), data.getFields().get("tags"));
        assertEquals(List.of("Painter"), data.getFields().get("authors"));
        assertEquals(List.of("Someone"), data.getFields().get("characters"));
        assertEquals(List.of("Original"), data.getFields().get("copyrights"));
        assertTrue(data.getExtraLinks().contains("https://e-shuushuu.net/image/1024/"));
    }

    @Test
    void toProviderData_pageWithoutImageIsEmpty() {
        assertTrue(provider.toProviderData("1", EShuushuuProvider.pageUrl("1"), "<html><body>Image not found</body></html>", null).isEmpty());
        assertTrue(provider.toProviderData("1", EShuushuuProvider.pageUrl("1"), "", null).isEmpty());
    }
}
