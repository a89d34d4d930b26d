package com.myorg.fanout.engine;

import com.myorg.fanout.contracts.core.conventions.Channels;
import com.myorg.fanout.contracts.publish.ResolutionMethod;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "fanout.engine")
public class FanoutEngineProperties {
    // dùng khi PublishOptions.method == null
    private ResolutionMethod defaultMethod = ResolutionMethod.DEMAND_SUBSCRIPTION;
    // kênh riêng của mỗi member: <prefix><memberId>
    private String privateChannelPrefix = Channels.DEFAULT_PRIVATE_PREFIX;
    // bộ hydrator được đăng ký sẵn
    private Domain domain = Domain.CLIMBING;

    private Hydration hydration = new Hydration();
    private Email email = new Email();
    private Executor executor = new Executor();
    private Transport transport = new Transport();

    public enum Domain { CLIMBING, DATASET, NONE }

    public enum EmailDelivery { AUTO, ON, OFF }

    @Data
    public static class Hydration {
        //false: bỏ qua kiểm tra quyền khi hydrate
        private boolean authorize = true;
        // số comment/note mới nhất được gắn vào
        private int commentLimit = 5;
    }

    @Data
    public static class Email {
        //auto: chỉ gửi khi profile prod/production đang bật
        private EmailDelivery delivery = EmailDelivery.AUTO;
    }

    @Data
    public static class Executor {
        private int coreSize = 8;
        private int maxSize = 32;
        private int queueCapacity = 10_000;
        private String threadNamePrefix = "fanout-";
    }

    @Data
    public static class Transport {
        private Redis redis = new Redis();

        @Data
        public static class Redis {
            //cho phép tắt redis transport dù có dependency
            private boolean enabled = true;
            // kênh pub/sub mà các socket gateway lắng nghe
            private String channel = "fanout:live";
        }
    }
}
