package io.github.samzhu.tracehub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Trace Hub 應用程式入口
 *
 * <p>Analytics Hub API 的執行追蹤層，為每個請求：
 * <ul>
 *   <li>從 {@code x-execution-id} / {@code x-parent-span-id} Header 解析執行上下文</li>
 *   <li>累積 repo span 與 agent spans 組成的執行階層</li>
 *   <li>確保每個非營運請求至少產生一個 agent span</li>
 *   <li>將階層序列化到回應（{@code _execution} 欄位或 {@code x-execution-trace} Header）</li>
 * </ul>
 *
 * @see io.github.samzhu.tracehub.filter.ExecutionContextFilter
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TraceHubApplication {

	public static void main(String[] args) {
		SpringApplication.run(TraceHubApplication.class, args);
	}

}
