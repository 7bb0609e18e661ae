package dustin.referral;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

@SpringBootApplication
@EnableKafka
public class ReferralLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReferralLedgerApplication.class, args);
	}

}
