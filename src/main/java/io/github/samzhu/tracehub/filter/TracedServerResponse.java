package io.github.samzhu.tracehub.filter;

import java.io.IOException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.function.ServerResponse;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 在原始回應外加上 {@code x-execution-trace} Header
 *
 * <p>body 完全交由原始回應寫出（entity、write function、rendering、SSE、async 皆適用），
 * 這裡只在寫出前設定 Header。
 */
final class TracedServerResponse implements ServerResponse {

    private final ServerResponse delegate;
    private final String trace;
    private final HttpHeaders headers;

    TracedServerResponse(ServerResponse delegate, String trace) {
        this.delegate = delegate;
        this.trace = trace;
        HttpHeaders merged = new HttpHeaders();
        merged.addAll(delegate.headers());
        merged.set(ExecutionResponseComposer.TRACE_HEADER, trace);
        this.headers = HttpHeaders.readOnlyHttpHeaders(merged);
    }

    ServerResponse delegate() {
        return delegate;
    }

    @Override
    public HttpStatusCode statusCode() {
        return delegate.statusCode();
    }

    @Deprecated
    public int rawStatusCode() {
        return delegate.statusCode().value();
    }

    @Override
    public HttpHeaders headers() {
        return headers;
    }

    @Override
    public MultiValueMap<String, Cookie> cookies() {
        return delegate.cookies();
    }

    @Override
    @Nullable
    public ModelAndView writeTo(HttpServletRequest request, HttpServletResponse response, Context context)
            throws ServletException, IOException {
        response.setHeader(ExecutionResponseComposer.TRACE_HEADER, trace);
        return delegate.writeTo(request, response, context);
    }
}
