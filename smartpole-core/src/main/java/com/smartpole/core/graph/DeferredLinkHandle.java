package com.smartpole.core.graph;

import java.util.Optional;
import java.util.regex.Pattern;

import lombok.Getter;

/**
 * 源端口尚未确定的延迟连接。由 {@link DynamicLinker} 在端口宣告后补全。
 */
@Getter
public class DeferredLinkHandle implements GraphLink {

    public enum Status {
        PENDING,
        ACTIVE,
        FAILED
    }

    private final String sourceNode;
    // 端口名模板，例如 stream_%u；null 表示接受任意端口
    private final String portTemplate;
    private final PortRef destination;
    private final Pattern portPattern;
    private Status status = Status.PENDING;
    private LinkHandle resolvedLink;

    DeferredLinkHandle(String sourceNode, String portTemplate, PortRef destination) {
        this.sourceNode = sourceNode;
        this.portTemplate = portTemplate;
        this.destination = destination;
        this.portPattern = portTemplate == null ? null : compileTemplate(portTemplate);
    }

    private static Pattern compileTemplate(String template) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '%' && i + 1 < template.length()) {
                char spec = template.charAt(i + 1);
                if (spec == 'u' || spec == 'd') {
                    regex.append("\\d+");
                    i += 2;
                    continue;
                }
                if (spec == 's') {
                    regex.append(".+");
                    i += 2;
                    continue;
                }
            }
            regex.append(Pattern.quote(String.valueOf(c)));
            i++;
        }
        return Pattern.compile(regex.toString());
    }

    boolean accepts(String portName) {
        return portPattern == null || portPattern.matcher(portName).matches();
    }

    void complete(LinkHandle link) {
        this.resolvedLink = link;
        this.status = Status.ACTIVE;
    }

    void fail() {
        this.resolvedLink = null;
        this.status = Status.FAILED;
    }

    public boolean isPending() {
        return status == Status.PENDING;
    }

    @Override
    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public Optional<LinkHandle> getResolvedLink() {
        return Optional.ofNullable(resolvedLink);
    }

    @Override
    public String toString() {
        return "%s.%s ~> %s [%s]".formatted(sourceNode, portTemplate == null ? "*" : portTemplate, destination,
                status);
    }
}
