/*
 * どこで: Notification アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行い、--run-once 指定時は 1 バッチで終了する
 * なぜ: 同一成果物を常駐ワーカー/realtime/単発実行のいずれでも起動できるようにするため
 */
package com.notifyhub.notification;

import com.notifyhub.common.config.TimeConfig;
import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NotificationApplication {

	static final String RUN_ONCE_FLAG = "--run-once";

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(NotificationApplication.class);
		if (!isRunOnce(args)) {
			application.run(args);
			return;
		}
		// コマンドライン引数は application.yml より優先されるため、ここで上書きする
		application.setWebApplicationType(WebApplicationType.NONE);
		ConfigurableApplicationContext context = application.run(runOnceArgs(args));
		System.exit(SpringApplication.exit(context));
	}

	static boolean isRunOnce(String[] args) {
		return Arrays.asList(args).contains(RUN_ONCE_FLAG);
	}

	static String[] runOnceArgs(String[] args) {
		String[] effective = Arrays.copyOf(args, args.length + 2);
		effective[args.length] = "--notification.worker.run-once=true";
		effective[args.length + 1] = "--notification.realtime.enabled=false";
		return effective;
	}
}
