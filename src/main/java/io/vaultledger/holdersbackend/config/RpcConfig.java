package io.vaultledger.holdersbackend.config;

import io.vaultledger.holdersbackend.client.ChainRpcClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
public class RpcConfig {

  @Bean(destroyMethod = "shutdown")
  public ChainRpcClients chainRpcClients(HoldersProperties properties) {
    return new ChainRpcClients(
        properties.getRpc().getUrls(), rpcUrl -> Web3j.build(new HttpService(rpcUrl)));
  }
}
