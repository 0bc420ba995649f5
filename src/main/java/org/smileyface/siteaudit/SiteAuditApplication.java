package org.smileyface.siteaudit;

import org.smileyface.siteaudit.crawler.CrawlerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
public class SiteAuditApplication {

	public static void main(String[] args) {
		SpringApplication.run(SiteAuditApplication.class, args);
	}
}
