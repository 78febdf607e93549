package com.linlay.agentroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/* 通过配置可以放开部分目录
```yaml
agent:
  tools:
    working-directory: /opt/app
    allowed-paths:
      - /opt
    shell:
      allowed-commands: [ls, cat, git]
```
*/

@ConfigurationProperties(prefix = "agent.tools")
public class ToolProperties {

    private String workingDirectory = "";
    private List<String> allowedPaths = new ArrayList<>();
    private Shell shell = new Shell();

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public List<String> getAllowedPaths() {
        return allowedPaths;
    }

    public void setAllowedPaths(List<String> allowedPaths) {
        this.allowedPaths = allowedPaths == null ? new ArrayList<>() : allowedPaths;
    }

    public Shell getShell() {
        return shell;
    }

    public void setShell(Shell shell) {
        this.shell = shell == null ? new Shell() : shell;
    }

    public static class Shell {
        private List<String> allowedCommands = new ArrayList<>(List.of(
                "ls", "pwd", "cat", "head", "tail", "wc", "grep", "find", "echo", "git", "df", "free"
        ));
        private Duration timeout = Duration.ofSeconds(10);
        private int maxOutputChars = 4000;

        public List<String> getAllowedCommands() {
            return allowedCommands;
        }

        public void setAllowedCommands(List<String> allowedCommands) {
            this.allowedCommands = allowedCommands == null ? new ArrayList<>() : allowedCommands;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxOutputChars() {
            return maxOutputChars;
        }

        public void setMaxOutputChars(int maxOutputChars) {
            this.maxOutputChars = maxOutputChars;
        }
    }
}
